package stocksync.engine.config;

import java.util.Locale;

/**
 * Sync presets.
 * INIT is a slow full-history load for first deployment, DAILY a fast incremental update.
 */
public enum SyncMode {

    INIT("init", 0.1, 2, null, true, 5, 0.5,
            "Initial load: slow full sync, one request every 10 seconds"),

    DAILY("daily", 1.0, 10, 3, false, 20, 5.0,
            "Daily update: fast incremental sync of the last days only");

    private final String value;
    private final double ratePerSecond;
    private final int burst;
    private final Integer daysToFetch;
    private final boolean forceFullSync;
    private final int maxConcurrent;
    private final double concurrentRatePerSecond;
    private final String description;

    SyncMode(String value, double ratePerSecond, int burst, Integer daysToFetch, boolean forceFullSync,
            int maxConcurrent, double concurrentRatePerSecond, String description) {
        this.value = value;
        this.ratePerSecond = ratePerSecond;
        this.burst = burst;
        this.daysToFetch = daysToFetch;
        this.forceFullSync = forceFullSync;
        this.maxConcurrent = maxConcurrent;
        this.concurrentRatePerSecond = concurrentRatePerSecond;
        this.description = description;
    }

    public String value() {
        return value;
    }

    public double ratePerSecond() {
        return ratePerSecond;
    }

    public int burst() {
        return burst;
    }

    /** Days of history to request; null means full history. */
    public Integer daysToFetch() {
        return daysToFetch;
    }

    public boolean forceFullSync() {
        return forceFullSync;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public double concurrentRatePerSecond() {
        return concurrentRatePerSecond;
    }

    public String description() {
        return description;
    }

    public static SyncMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("sync mode is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SyncMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown sync mode: " + name);
    }

    /**
     * Rough duration of a run over {@code targetCount} targets at this mode's steady rate.
     */
    public SyncEstimate estimateSyncTime(int targetCount) {
        if (targetCount < 0) {
            throw new IllegalArgumentException("targetCount must not be negative");
        }
        double totalSeconds = targetCount / ratePerSecond;
        return SyncEstimate.of(totalSeconds, targetCount, this);
    }

    /**
     * Estimated run duration.
     */
    public record SyncEstimate(double totalSeconds, int hours, int minutes, int seconds,
            int targetCount, SyncMode mode) {

        static SyncEstimate of(double totalSeconds, int targetCount, SyncMode mode) {
            long whole = (long) totalSeconds;
            int hours = (int) (whole / 3600);
            int minutes = (int) ((whole % 3600) / 60);
            int seconds = (int) (whole % 60);
            return new SyncEstimate(totalSeconds, hours, minutes, seconds, targetCount, mode);
        }

        public String formatted() {
            return String.format(Locale.ROOT, "%dh %dm %ds", hours, minutes, seconds);
        }
    }
}
