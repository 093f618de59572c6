package stocksync.engine.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import stocksync.engine.batch.BatchProgress;
import stocksync.engine.batch.BatchStatus;
import stocksync.engine.model.TaskCommandResult;
import stocksync.engine.model.TaskInfo;
import stocksync.engine.model.TaskListing;
import stocksync.engine.model.TaskStatus;
import stocksync.engine.util.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON shape of the read models.
 */
class DtoJsonTest {

    private static JsonNode toJson(Object value) throws Exception {
        return Json.mapper().readTree(Json.write(value));
    }

    @Test
    @DisplayName("TaskView uses lower-case status and omits nulls")
    void taskViewShape() throws Exception {
        TaskInfo info = TaskInfo.builder()
                .id("task-1")
                .type("kline_sync")
                .status(TaskStatus.RUNNING)
                .progress(12.3456)
                .message("[1/8] Syncing 600000.SH")
                .params(Map.of("limit", 8))
                .createdAt(Instant.parse("2024-06-12T01:00:00Z"))
                .build();

        JsonNode json = toJson(TaskView.from(info));

        assertEquals("task-1", json.get("taskId").asText());
        assertEquals("running", json.get("status").asText());
        assertEquals(12.35, json.get("progress").asDouble(), 1e-9);
        assertEquals(8, json.get("params").get("limit").asInt());
        assertEquals("2024-06-12T01:00:00Z", json.get("createdAt").asText());
        assertFalse(json.has("error"));
        assertFalse(json.has("result"));
        assertFalse(json.has("details"));
    }

    @Test
    void taskListViewCarriesCounts() throws Exception {
        TaskInfo a = TaskInfo.builder().id("a").type("x").status(TaskStatus.RUNNING).params(Map.of("k", 1)).build();
        TaskInfo b = TaskInfo.builder().id("b").type("x").status(TaskStatus.PENDING).build();

        JsonNode json = toJson(TaskListView.from(new TaskListing(List.of(a, b), 5, 1, 1)));

        assertEquals(2, json.get("tasks").size());
        assertEquals(5, json.get("total").asInt());
        assertEquals(1, json.get("running").asInt());
        assertFalse(json.get("tasks").get(0).has("params"), "list entries are compact");
    }

    @Test
    void batchProgressViewShape() throws Exception {
        BatchProgress progress = BatchProgress.builder()
                .batchId("20240612_090000_1")
                .batchIndex(1)
                .totalBatches(3)
                .totalCount(500)
                .currentIndex(42)
                .currentItem("600000.SH", "浦发银行")
                .progress(8.2)
                .status(BatchStatus.COMPLETED_WITH_ERRORS)
                .build();

        JsonNode json = toJson(BatchProgressView.from(progress));

        assertEquals("completed_with_errors", json.get("status").asText());
        assertEquals("600000.SH", json.get("currentItem").get("tsCode").asText());
        assertEquals(42, json.get("currentIndex").asInt());
        assertFalse(json.has("endTime"));
    }

    @Test
    void commandResponse() {
        assertTrue(CommandResponse.of("t", "pause", TaskCommandResult.APPLIED).ok());

        CommandResponse rejected = CommandResponse.of("t", "pause", TaskCommandResult.INVALID_STATE);
        assertFalse(rejected.ok());
        assertEquals("Cannot pause task in its current state", rejected.error());
        assertEquals("Task not found", CommandResponse.of("t", "cancel", TaskCommandResult.NOT_FOUND).error());
    }
}
