package stocksync.engine.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of syncing one target.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemOutcome(
        @JsonProperty("tsCode") String tsCode,
        @JsonProperty("name") String name,
        @JsonProperty("status") Status status,
        @JsonProperty("count") int count,
        @JsonProperty("syncMode") String syncMode,
        @JsonProperty("error") String error) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static ItemOutcome succeeded(SyncTarget target, int count, String syncMode) {
        return new ItemOutcome(target.tsCode(), target.name(), Status.SUCCEEDED, count, syncMode, null);
    }

    public static ItemOutcome failed(SyncTarget target, String error) {
        return new ItemOutcome(target.tsCode(), target.name(), Status.FAILED, 0, null, error);
    }

    public static ItemOutcome skipped(SyncTarget target) {
        return new ItemOutcome(target.tsCode(), target.name(), Status.SKIPPED, 0, null, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
