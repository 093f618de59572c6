package stocksync.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import stocksync.engine.model.TaskCommandResult;

/**
 * Reply to cancel / pause / resume / delete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("error") String error) {

    public static CommandResponse of(String taskId, String command, TaskCommandResult result) {
        return switch (result) {
            case APPLIED -> new CommandResponse(true, taskId, null);
            case NOT_FOUND -> new CommandResponse(false, taskId, "Task not found");
            case INVALID_STATE -> new CommandResponse(false, taskId, "Cannot " + command + " task in its current state");
        };
    }
}
