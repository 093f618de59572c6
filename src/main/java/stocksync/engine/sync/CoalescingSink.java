package stocksync.engine.sync;

import stocksync.engine.write.FlushSink;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Flattens buffered per-target rows into one keyed write.
 *
 * <p>Rows are keyed by {@link BarKey}; when the same (code, date) appears more than once
 * in a chunk the later row wins, which gives the delegate upsert semantics. The map is
 * built once per flushed chunk.
 */
public class CoalescingSink<R> implements FlushSink<FetchedRows<R>> {

    private final Function<R, LocalDate> tradeDateOf;
    private final FlushSink<KeyedRow<R>> delegate;

    public CoalescingSink(Function<R, LocalDate> tradeDateOf, FlushSink<KeyedRow<R>> delegate) {
        this.tradeDateOf = tradeDateOf;
        this.delegate = delegate;
    }

    @Override
    public void flush(List<FetchedRows<R>> items) throws Exception {
        Map<BarKey, R> merged = new TreeMap<>();
        for (FetchedRows<R> item : items) {
            for (R row : item.rows()) {
                merged.put(new BarKey(item.tsCode(), tradeDateOf.apply(row)), row);
            }
        }
        if (merged.isEmpty()) {
            return;
        }

        List<KeyedRow<R>> rows = new ArrayList<>(merged.size());
        merged.forEach((key, row) -> rows.add(new KeyedRow<>(key, row)));
        delegate.flush(rows);
    }

    /**
     * A row with its composite key.
     */
    public record KeyedRow<R>(BarKey key, R row) {
    }
}
