package stocksync.engine.batch;

import stocksync.engine.sync.SyncTarget;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One planned unit of work: the target plus the freshness marker it was prioritized by.
 * A null marker means the target has no stored data yet.
 */
public record BatchItem(SyncTarget target, LocalDate freshness) {

    public BatchItem {
        Objects.requireNonNull(target, "target is required");
    }

    public static BatchItem of(SyncTarget target) {
        return new BatchItem(target, target.latestDate());
    }
}
