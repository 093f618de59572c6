package stocksync.engine.batch;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An immutable chunk of a sync plan. Ids are {@code {prefix}_{index}} with a 1-based index.
 */
public record Batch(
        String batchId,
        int batchIndex,
        int totalBatches,
        List<BatchItem> items,
        BatchStatus status,
        Instant createdAt) {

    public Batch {
        Objects.requireNonNull(batchId, "batchId is required");
        items = List.copyOf(items);
        status = status == null ? BatchStatus.PENDING : status;
    }

    public int itemCount() {
        return items.size();
    }
}
