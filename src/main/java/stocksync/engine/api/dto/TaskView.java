package stocksync.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import stocksync.engine.model.TaskInfo;

import java.time.Instant;
import java.util.Map;

/**
 * Read model of a queued task, as exposed to pollers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("status") String status,
        @JsonProperty("progress") double progress,
        @JsonProperty("message") String message,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    /** Create view from domain snapshot */
    public static TaskView from(TaskInfo info) {
        return new TaskView(
                info.id(),
                info.type(),
                info.status().value(),
                Math.round(info.progress() * 100.0) / 100.0,
                info.message(),
                info.params().isEmpty() ? null : info.params(),
                info.details().isEmpty() ? null : info.details(),
                info.result(),
                info.error(),
                info.createdAt(),
                info.startedAt(),
                info.completedAt());
    }

    /** Compact version for list responses */
    public TaskView compact() {
        return new TaskView(taskId, taskType, status, progress, message, null, null, null, error,
                createdAt, startedAt, completedAt);
    }
}
