package stocksync.engine.sync;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A security to synchronize, with its freshness marker.
 *
 * @param tsCode     exchange-qualified code, e.g. {@code 600000.SH}
 * @param name       display name
 * @param active     whether the security is still listed
 * @param latestDate date of the newest stored bar, or null if nothing is stored yet
 */
public record SyncTarget(String tsCode, String name, boolean active, LocalDate latestDate) {

    public SyncTarget {
        Objects.requireNonNull(tsCode, "tsCode is required");
        if (tsCode.isBlank()) {
            throw new IllegalArgumentException("tsCode must not be blank");
        }
        name = name == null ? "" : name;
    }

    public static SyncTarget of(String tsCode, String name, LocalDate latestDate) {
        return new SyncTarget(tsCode, name, true, latestDate);
    }

    public SyncTarget withLatestDate(LocalDate date) {
        return new SyncTarget(tsCode, name, active, date);
    }

    public String label() {
        return name.isEmpty() ? tsCode : tsCode + " " + name;
    }
}
