package stocksync.engine.model;

import java.util.Locale;

/**
 * Task execution status.
 */
public enum TaskStatus {
    /** Task queued, waiting for a worker */
    PENDING,
    /** Task picked up by a worker and being executed */
    RUNNING,
    /** Task suspended by the user, resumes at the executor's next safe point */
    PAUSED,
    /** Task completed successfully */
    SUCCESS,
    /** Task failed with an error */
    FAILED,
    /** Task cancelled by user or by queue shutdown */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }

    /** Queued or in flight (including paused). */
    public boolean isActive() {
        return this == PENDING || this == RUNNING || this == PAUSED;
    }

    /** Lower-case wire value ("pending", "running", ...). */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
