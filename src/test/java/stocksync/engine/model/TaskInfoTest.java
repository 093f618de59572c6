package stocksync.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskInfoTest {

    @Test
    void buildMinimalTaskInfo() {
        TaskInfo info = TaskInfo.builder()
                .id("task-1")
                .type("kline_sync")
                .build();

        assertEquals("task-1", info.id());
        assertEquals(TaskStatus.PENDING, info.status());
        assertEquals(0.0, info.progress());
        assertEquals("", info.message());
        assertTrue(info.params().isEmpty());
        assertTrue(info.details().isEmpty());
        assertNull(info.result());
        assertNull(info.error());
    }

    @Test
    void progressIsClampedToPercentRange() {
        assertEquals(100.0, TaskInfo.builder().id("t").type("x").progress(250.0).build().progress());
        assertEquals(0.0, TaskInfo.builder().id("t").type("x").progress(-3.0).build().progress());
        assertEquals(0.0, TaskInfo.builder().id("t").type("x").progress(Double.NaN).build().progress());
    }

    @Test
    void paramsAreCopiedAndFrozen() {
        Map<String, Object> params = new HashMap<>();
        params.put("limit", 5);
        TaskInfo info = TaskInfo.builder().id("t").type("x").params(params).build();

        params.put("limit", 99);

        assertEquals(5, info.params().get("limit"));
        assertThrows(UnsupportedOperationException.class, () -> info.params().put("x", 1));
    }

    @Test
    void toBuilderKeepsEverything() {
        Instant now = Instant.now();
        TaskInfo original = TaskInfo.builder()
                .id("t")
                .type("x")
                .status(TaskStatus.RUNNING)
                .progress(40.0)
                .message("working")
                .details(Map.of("current", "000001.SZ"))
                .createdAt(now)
                .startedAt(now)
                .build();

        TaskInfo copy = original.toBuilder().build();

        assertEquals(original, copy);
        assertEquals("000001.SZ", copy.details().get("current"));
        assertEquals(now, copy.startedAt());
    }

    @Test
    void isTerminal() {
        assertFalse(TaskInfo.builder().id("a").type("x").status(TaskStatus.PENDING).build().isTerminal());
        assertFalse(TaskInfo.builder().id("b").type("x").status(TaskStatus.PAUSED).build().isTerminal());
        assertTrue(TaskInfo.builder().id("c").type("x").status(TaskStatus.SUCCESS).build().isTerminal());
        assertTrue(TaskInfo.builder().id("d").type("x").status(TaskStatus.FAILED).build().isTerminal());
        assertTrue(TaskInfo.builder().id("e").type("x").status(TaskStatus.CANCELLED).build().isTerminal());
    }

    @Test
    void statusValuesRoundTrip() {
        for (TaskStatus status : TaskStatus.values()) {
            assertEquals(status, TaskStatus.fromValue(status.value()));
        }
        assertEquals("running", TaskStatus.RUNNING.value());
    }
}
