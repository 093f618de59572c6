package stocksync.engine.queue;

import stocksync.engine.model.TaskInfo;
import stocksync.engine.model.TaskStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * A queued unit of work: identity, its {@link TaskControl} and the current
 * {@link TaskInfo} snapshot.
 *
 * <p>Every change replaces the whole snapshot with a compare-and-set, so status queries
 * racing a worker see either the old or the new state, never a mix. Status changes are
 * guarded by the expected source states; a terminal snapshot is never replaced.
 */
public final class Task {

    private final String id;
    private final String type;
    private final TaskControl control = new TaskControl();
    private final AtomicReference<TaskInfo> state;

    Task(String id, String type, Map<String, Object> params, String message, Instant createdAt) {
        this.id = id;
        this.type = type;
        this.state = new AtomicReference<>(TaskInfo.builder()
                .id(id)
                .type(type)
                .params(params)
                .status(TaskStatus.PENDING)
                .message(message)
                .createdAt(createdAt)
                .build());
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public Map<String, Object> params() {
        return state.get().params();
    }

    public TaskControl control() {
        return control;
    }

    /** Current snapshot. */
    public TaskInfo info() {
        return state.get();
    }

    public TaskStatus status() {
        return state.get().status();
    }

    /**
     * Report progress from inside the executor. Ignored once the task is terminal.
     */
    public void updateProgress(double progress, String message) {
        updateProgress(progress, message, Map.of());
    }

    /**
     * Report progress with extra detail entries merged into the snapshot's details.
     */
    public void updateProgress(double progress, String message, Map<String, Object> details) {
        mutateActive(s -> {
            TaskInfo.Builder b = s.toBuilder().progress(progress);
            if (message != null && !message.isEmpty()) {
                b.message(message);
            }
            if (details != null && !details.isEmpty()) {
                Map<String, Object> merged = new LinkedHashMap<>(s.details());
                merged.putAll(details);
                b.details(merged);
            }
            return b.build();
        });
    }

    public void setResult(Map<String, Object> result) {
        mutateActive(s -> s.toBuilder().result(result).build());
    }

    /**
     * Replace the snapshot only if its status is one of {@code from}.
     *
     * @return true if the update was applied
     */
    boolean transition(Set<TaskStatus> from, UnaryOperator<TaskInfo> update) {
        while (true) {
            TaskInfo current = state.get();
            if (!from.contains(current.status())) {
                return false;
            }
            if (state.compareAndSet(current, update.apply(current))) {
                return true;
            }
        }
    }

    private void mutateActive(UnaryOperator<TaskInfo> update) {
        while (true) {
            TaskInfo current = state.get();
            if (current.isTerminal()) {
                return;
            }
            if (state.compareAndSet(current, update.apply(current))) {
                return;
            }
        }
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type='" + type + "', status=" + status() + "}";
    }
}
