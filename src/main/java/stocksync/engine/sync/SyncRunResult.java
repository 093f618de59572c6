package stocksync.engine.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a sync run over many targets. Item details are bounded samples; the full
 * list only goes to the log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncRunResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("total") int total,
        @JsonProperty("succeededCount") int succeededCount,
        @JsonProperty("failedCount") int failedCount,
        @JsonProperty("skippedCount") int skippedCount,
        @JsonProperty("exceptionCount") int exceptionCount,
        @JsonProperty("cancelled") boolean cancelled,
        @JsonProperty("succeeded") List<ItemOutcome> succeeded,
        @JsonProperty("failed") List<ItemOutcome> failed) {

    public SyncRunResult {
        succeeded = succeeded == null ? List.of() : List.copyOf(succeeded);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public static SyncRunResult empty(String message) {
        return new SyncRunResult(true, message, 0, 0, 0, 0, 0, false, List.of(), List.of());
    }

    /**
     * Collects outcomes, keeping counts exact and item lists bounded.
     */
    public static final class Collector {
        private final int sampleSize;
        private final List<ItemOutcome> succeeded = new ArrayList<>();
        private final List<ItemOutcome> failed = new ArrayList<>();
        private int succeededCount;
        private int failedCount;
        private int skippedCount;
        private int exceptionCount;

        public Collector(int sampleSize) {
            this.sampleSize = sampleSize;
        }

        public synchronized void add(ItemOutcome outcome) {
            switch (outcome.status()) {
                case SUCCEEDED -> {
                    succeededCount++;
                    if (succeeded.size() < sampleSize) {
                        succeeded.add(outcome);
                    }
                }
                case FAILED -> {
                    failedCount++;
                    if (failed.size() < sampleSize) {
                        failed.add(outcome);
                    }
                }
                case SKIPPED -> skippedCount++;
            }
        }

        public synchronized void addException() {
            exceptionCount++;
        }

        public synchronized int succeededCount() {
            return succeededCount;
        }

        public synchronized int failedCount() {
            return failedCount;
        }

        public synchronized int skippedCount() {
            return skippedCount;
        }

        public synchronized int exceptionCount() {
            return exceptionCount;
        }

        public synchronized List<ItemOutcome> succeededSample() {
            return List.copyOf(succeeded);
        }

        public synchronized List<ItemOutcome> failedSample() {
            return List.copyOf(failed);
        }

        public synchronized SyncRunResult build(int total, boolean cancelled) {
            String message = String.format("Sync %s: %d succeeded, %d failed, %d skipped, %d errors",
                    cancelled ? "cancelled" : "finished",
                    succeededCount, failedCount, skippedCount, exceptionCount);
            return new SyncRunResult(failedCount == 0 && exceptionCount == 0 && !cancelled, message, total,
                    succeededCount, failedCount, skippedCount, exceptionCount, cancelled,
                    succeeded, failed);
        }
    }
}
