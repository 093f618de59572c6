package stocksync.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import stocksync.engine.model.TaskListing;

import java.util.List;

/**
 * Task list with the counters a dashboard polls for.
 */
public record TaskListView(
        @JsonProperty("tasks") List<TaskView> tasks,
        @JsonProperty("total") int total,
        @JsonProperty("running") int running,
        @JsonProperty("pending") int pending) {

    public static TaskListView from(TaskListing listing) {
        List<TaskView> views = listing.tasks().stream()
                .map(TaskView::from)
                .map(TaskView::compact)
                .toList();
        return new TaskListView(views, listing.total(), listing.running(), listing.pending());
    }
}
