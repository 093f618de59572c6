package stocksync.engine.config;

import java.time.Duration;

/**
 * Configuration holder for the sync engine.
 * All settings have sensible defaults.
 */
public final class SyncConfig {

    // Task queue settings
    private int workerCount = 2;
    private double queueRatePerSecond = 0.2;
    private int queueBurst = 3;

    // Batch planning settings
    private int batchSize = 500;
    private int recencyWindowDays = 7;
    private int failureSampleSize = 10;

    // Write buffer settings
    private int writerBatchSize = 50;
    private Duration writerFlushInterval = Duration.ofSeconds(3);

    // Concurrent sync settings
    private int maxConcurrent = 20;
    private double concurrentRatePerSecond = 5.0;
    private int blockingPoolSize = 20;

    // Unit-of-work reliability
    private Duration requestTimeout = Duration.ofSeconds(60);
    private int maxRetries = 3;
    private Duration retryBackoffStep = Duration.ofSeconds(3);

    private SyncConfig() {
    }

    public static SyncConfig defaults() {
        return new SyncConfig();
    }

    public static SyncConfig fromEnv() {
        SyncConfig config = new SyncConfig();

        String workers = System.getenv("STOCKSYNC_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workerCount = Integer.parseInt(workers.trim());
        }

        String rate = System.getenv("STOCKSYNC_RATE");
        if (rate != null && !rate.isBlank()) {
            config.queueRatePerSecond = Double.parseDouble(rate.trim());
        }

        String burst = System.getenv("STOCKSYNC_BURST");
        if (burst != null && !burst.isBlank()) {
            config.queueBurst = Integer.parseInt(burst.trim());
        }

        String batchSize = System.getenv("STOCKSYNC_BATCH_SIZE");
        if (batchSize != null && !batchSize.isBlank()) {
            config.batchSize = Integer.parseInt(batchSize.trim());
        }

        String timeout = System.getenv("STOCKSYNC_REQUEST_TIMEOUT_SEC");
        if (timeout != null && !timeout.isBlank()) {
            config.requestTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        String retries = System.getenv("STOCKSYNC_MAX_RETRIES");
        if (retries != null && !retries.isBlank()) {
            config.maxRetries = Integer.parseInt(retries.trim());
        }

        return config;
    }

    /**
     * Start from the preset rates of a sync mode.
     */
    public static SyncConfig forMode(SyncMode mode) {
        SyncConfig config = new SyncConfig();
        config.queueRatePerSecond = mode.ratePerSecond();
        config.queueBurst = mode.burst();
        config.maxConcurrent = mode.maxConcurrent();
        config.concurrentRatePerSecond = mode.concurrentRatePerSecond();
        return config;
    }

    // Getters
    public int workerCount() {
        return workerCount;
    }

    public double queueRatePerSecond() {
        return queueRatePerSecond;
    }

    public int queueBurst() {
        return queueBurst;
    }

    public int batchSize() {
        return batchSize;
    }

    public int recencyWindowDays() {
        return recencyWindowDays;
    }

    public int failureSampleSize() {
        return failureSampleSize;
    }

    public int writerBatchSize() {
        return writerBatchSize;
    }

    public Duration writerFlushInterval() {
        return writerFlushInterval;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public double concurrentRatePerSecond() {
        return concurrentRatePerSecond;
    }

    public int blockingPoolSize() {
        return blockingPoolSize;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration retryBackoffStep() {
        return retryBackoffStep;
    }

    // Fluent setters for testing/customization
    public SyncConfig withWorkerCount(int workers) {
        this.workerCount = workers;
        return this;
    }

    public SyncConfig withQueueRate(double ratePerSecond, int burst) {
        this.queueRatePerSecond = ratePerSecond;
        this.queueBurst = burst;
        return this;
    }

    public SyncConfig withBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public SyncConfig withRecencyWindowDays(int days) {
        this.recencyWindowDays = days;
        return this;
    }

    public SyncConfig withFailureSampleSize(int size) {
        this.failureSampleSize = size;
        return this;
    }

    public SyncConfig withWriter(int batchSize, Duration flushInterval) {
        this.writerBatchSize = batchSize;
        this.writerFlushInterval = flushInterval;
        return this;
    }

    public SyncConfig withConcurrency(int maxConcurrent, double ratePerSecond) {
        this.maxConcurrent = maxConcurrent;
        this.concurrentRatePerSecond = ratePerSecond;
        return this;
    }

    public SyncConfig withBlockingPoolSize(int size) {
        this.blockingPoolSize = size;
        return this;
    }

    public SyncConfig withRetry(Duration requestTimeout, int maxRetries, Duration backoffStep) {
        this.requestTimeout = requestTimeout;
        this.maxRetries = maxRetries;
        this.retryBackoffStep = backoffStep;
        return this;
    }

    @Override
    public String toString() {
        return "SyncConfig{" +
                "workers=" + workerCount +
                ", rate=" + queueRatePerSecond +
                ", burst=" + queueBurst +
                ", batchSize=" + batchSize +
                ", maxConcurrent=" + maxConcurrent +
                ", requestTimeout=" + requestTimeout +
                ", maxRetries=" + maxRetries +
                '}';
    }
}
