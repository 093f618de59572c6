package stocksync.engine.sync;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Composite (security, trade date) key for joining and de-duplicating date-keyed rows.
 */
public record BarKey(String tsCode, LocalDate tradeDate) implements Comparable<BarKey> {

    public BarKey {
        Objects.requireNonNull(tsCode, "tsCode is required");
        Objects.requireNonNull(tradeDate, "tradeDate is required");
    }

    @Override
    public int compareTo(BarKey other) {
        int byCode = tsCode.compareTo(other.tsCode);
        return byCode != 0 ? byCode : tradeDate.compareTo(other.tradeDate);
    }
}
