package stocksync.engine.model;

import java.util.List;

/**
 * A page of task snapshots, newest first, with counts over the filtered set.
 */
public record TaskListing(List<TaskInfo> tasks, int total, int running, int pending) {

    public TaskListing {
        tasks = List.copyOf(tasks);
    }
}
