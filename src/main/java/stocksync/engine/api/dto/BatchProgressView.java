package stocksync.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import stocksync.engine.batch.BatchProgress;

import java.time.Instant;

/**
 * Read model of a batch execution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchProgressView(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("batchIndex") int batchIndex,
        @JsonProperty("totalBatches") int totalBatches,
        @JsonProperty("totalCount") int totalCount,
        @JsonProperty("currentIndex") int currentIndex,
        @JsonProperty("currentItem") CurrentItem currentItem,
        @JsonProperty("progress") double progress,
        @JsonProperty("status") String status,
        @JsonProperty("succeededCount") int succeededCount,
        @JsonProperty("failedCount") int failedCount,
        @JsonProperty("skippedCount") int skippedCount,
        @JsonProperty("startTime") Instant startTime,
        @JsonProperty("endTime") Instant endTime,
        @JsonProperty("message") String message) {

    public record CurrentItem(
            @JsonProperty("tsCode") String tsCode,
            @JsonProperty("name") String name) {
    }

    public static BatchProgressView from(BatchProgress p) {
        CurrentItem current = p.currentTsCode() == null ? null : new CurrentItem(p.currentTsCode(), p.currentName());
        return new BatchProgressView(
                p.batchId(),
                p.batchIndex(),
                p.totalBatches(),
                p.totalCount(),
                p.currentIndex(),
                current,
                p.progress(),
                p.status().value(),
                p.succeededCount(),
                p.failedCount(),
                p.skippedCount(),
                p.startTime(),
                p.endTime(),
                p.message());
    }
}
