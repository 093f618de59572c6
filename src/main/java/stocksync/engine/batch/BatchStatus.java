package stocksync.engine.batch;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a planned batch.
 */
public enum BatchStatus {
    /** Planned, not yet executed */
    PENDING,

    /** Items are being synced */
    RUNNING,

    /** Every attempted item succeeded */
    COMPLETED,

    /** Finished, at least one item failed */
    COMPLETED_WITH_ERRORS,

    /** Stopped early by a cancel request */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS || this == CANCELLED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
