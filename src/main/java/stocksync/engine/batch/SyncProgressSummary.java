package stocksync.engine.batch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Freshness overview of the eligible targets, computed on demand.
 */
public record SyncProgressSummary(
        @JsonProperty("totalTargets") int totalTargets,
        @JsonProperty("needUpdate") int needUpdate,
        @JsonProperty("upToDate") int upToDate,
        @JsonProperty("latestTradeDate") LocalDate latestTradeDate,
        @JsonProperty("needUpdateSample") List<Entry> needUpdateSample,
        @JsonProperty("upToDateSample") List<Entry> upToDateSample) {

    public SyncProgressSummary {
        needUpdateSample = List.copyOf(needUpdateSample);
        upToDateSample = List.copyOf(upToDateSample);
    }

    public record Entry(
            @JsonProperty("tsCode") String tsCode,
            @JsonProperty("name") String name,
            @JsonProperty("latestDate") LocalDate latestDate) {
    }
}
