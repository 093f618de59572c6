package stocksync.engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a queued task's state.
 * The live task swaps whole snapshots, so a reader never sees a half-applied update.
 */
public final class TaskInfo {
    private final String id;
    private final String type;
    private final Map<String, Object> params;
    private final TaskStatus status;
    private final double progress; // 0..100
    private final String message;
    private final Map<String, Object> result;
    private final String error;
    private final Map<String, Object> details;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private TaskInfo(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.params = freeze(builder.params);
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = clampProgress(builder.progress);
        this.message = builder.message == null ? "" : builder.message;
        this.result = builder.result == null ? null : freeze(builder.result);
        this.error = builder.error;
        this.details = freeze(builder.details);
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public Map<String, Object> params() {
        return params;
    }

    public TaskStatus status() {
        return status;
    }

    public double progress() {
        return progress;
    }

    public String message() {
        return message;
    }

    public Map<String, Object> result() {
        return result;
    }

    public String error() {
        return error;
    }

    public Map<String, Object> details() {
        return details;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this snapshot (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .params(params)
                .status(status)
                .progress(progress)
                .message(message)
                .result(result)
                .error(error)
                .details(details)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    static double clampProgress(double progress) {
        if (Double.isNaN(progress) || progress < 0.0) {
            return 0.0;
        }
        return Math.min(100.0, progress);
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {
        private String id;
        private String type;
        private Map<String, Object> params;
        private TaskStatus status = TaskStatus.PENDING;
        private double progress = 0.0;
        private String message;
        private Map<String, Object> result;
        private String error;
        private Map<String, Object> details;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public TaskInfo build() {
            return new TaskInfo(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskInfo other))
            return false;
        return Objects.equals(id, other.id)
                && status == other.status
                && Double.compare(progress, other.progress) == 0
                && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, progress, message);
    }

    @Override
    public String toString() {
        return "TaskInfo{id='" + id + "', type='" + type + "', status=" + status
                + ", progress=" + progress + "}";
    }
}
