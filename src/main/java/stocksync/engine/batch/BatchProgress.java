package stocksync.engine.batch;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a batch execution, published to the progress store
 * at start, after every item and on completion.
 */
public final class BatchProgress {
    private final String batchId;
    private final int batchIndex;
    private final int totalBatches;
    private final int totalCount;
    private final int currentIndex;
    private final String currentTsCode;
    private final String currentName;
    private final double progress;
    private final BatchStatus status;
    private final int succeededCount;
    private final int failedCount;
    private final int skippedCount;
    private final Instant startTime;
    private final Instant endTime;
    private final String message;

    private BatchProgress(Builder builder) {
        this.batchId = Objects.requireNonNull(builder.batchId, "batchId is required");
        this.batchIndex = builder.batchIndex;
        this.totalBatches = builder.totalBatches;
        this.totalCount = builder.totalCount;
        this.currentIndex = builder.currentIndex;
        this.currentTsCode = builder.currentTsCode;
        this.currentName = builder.currentName;
        this.progress = builder.progress;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.succeededCount = builder.succeededCount;
        this.failedCount = builder.failedCount;
        this.skippedCount = builder.skippedCount;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.message = builder.message == null ? "" : builder.message;
    }

    // Getters
    public String batchId() {
        return batchId;
    }

    public int batchIndex() {
        return batchIndex;
    }

    public int totalBatches() {
        return totalBatches;
    }

    public int totalCount() {
        return totalCount;
    }

    /** 1-based index of the item being processed; 0 before the first one. */
    public int currentIndex() {
        return currentIndex;
    }

    public String currentTsCode() {
        return currentTsCode;
    }

    public String currentName() {
        return currentName;
    }

    public double progress() {
        return progress;
    }

    public BatchStatus status() {
        return status;
    }

    public int succeededCount() {
        return succeededCount;
    }

    public int failedCount() {
        return failedCount;
    }

    public int skippedCount() {
        return skippedCount;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public String message() {
        return message;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .batchId(batchId)
                .batchIndex(batchIndex)
                .totalBatches(totalBatches)
                .totalCount(totalCount)
                .currentIndex(currentIndex)
                .currentItem(currentTsCode, currentName)
                .progress(progress)
                .status(status)
                .succeededCount(succeededCount)
                .failedCount(failedCount)
                .skippedCount(skippedCount)
                .startTime(startTime)
                .endTime(endTime)
                .message(message);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String batchId;
        private int batchIndex;
        private int totalBatches;
        private int totalCount;
        private int currentIndex;
        private String currentTsCode;
        private String currentName;
        private double progress;
        private BatchStatus status = BatchStatus.PENDING;
        private int succeededCount;
        private int failedCount;
        private int skippedCount;
        private Instant startTime;
        private Instant endTime;
        private String message;

        public Builder batchId(String batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder batchIndex(int batchIndex) {
            this.batchIndex = batchIndex;
            return this;
        }

        public Builder totalBatches(int totalBatches) {
            this.totalBatches = totalBatches;
            return this;
        }

        public Builder totalCount(int totalCount) {
            this.totalCount = totalCount;
            return this;
        }

        public Builder currentIndex(int currentIndex) {
            this.currentIndex = currentIndex;
            return this;
        }

        public Builder currentItem(String tsCode, String name) {
            this.currentTsCode = tsCode;
            this.currentName = name;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder status(BatchStatus status) {
            this.status = status;
            return this;
        }

        public Builder succeededCount(int succeededCount) {
            this.succeededCount = succeededCount;
            return this;
        }

        public Builder failedCount(int failedCount) {
            this.failedCount = failedCount;
            return this;
        }

        public Builder skippedCount(int skippedCount) {
            this.skippedCount = skippedCount;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public BatchProgress build() {
            return new BatchProgress(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BatchProgress other))
            return false;
        return batchId.equals(other.batchId)
                && currentIndex == other.currentIndex
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchId, currentIndex, status);
    }

    @Override
    public String toString() {
        return "BatchProgress{batchId='" + batchId + "', " + currentIndex + "/" + totalCount
                + ", status=" + status + ", progress=" + progress + "}";
    }
}
