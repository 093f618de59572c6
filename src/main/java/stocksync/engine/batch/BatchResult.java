package stocksync.engine.batch;

import stocksync.engine.sync.ItemOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of executing one batch. Counts are exact, item lists are bounded samples.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResult(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("batchIndex") int batchIndex,
        @JsonProperty("totalBatches") int totalBatches,
        @JsonProperty("success") boolean success,
        @JsonProperty("status") BatchStatus status,
        @JsonProperty("message") String message,
        @JsonProperty("total") int total,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("succeededCount") int succeededCount,
        @JsonProperty("failedCount") int failedCount,
        @JsonProperty("succeeded") List<ItemOutcome> succeeded,
        @JsonProperty("failed") List<ItemOutcome> failed) {

    public BatchResult {
        succeeded = succeeded == null ? List.of() : List.copyOf(succeeded);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }
}
