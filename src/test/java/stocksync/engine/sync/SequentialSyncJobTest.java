package stocksync.engine.sync;

import stocksync.engine.limiter.RateLimiter;
import stocksync.engine.model.JobDescriptor;
import stocksync.engine.model.TaskInfo;
import stocksync.engine.model.TaskStatus;
import stocksync.engine.queue.TaskHandlerRegistry;
import stocksync.engine.queue.TaskQueue;
import stocksync.engine.store.InMemoryTaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the sequential job through a real queue.
 */
class SequentialSyncJobTest {

    private TaskQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.stop();
        }
    }

    private TaskInfo runJob(SequentialSyncJob<String> job, Map<String, Object> params) throws InterruptedException {
        queue = new TaskQueue("seq", 1, new RateLimiter(1000.0, 10), new InMemoryTaskRepository(),
                new TaskHandlerRegistry().register(SequentialSyncJob.KIND, job), Duration.ofSeconds(1));
        String id = queue.submit(JobDescriptor.of(SequentialSyncJob.KIND, params));

        long deadline = System.currentTimeMillis() + 5000;
        TaskInfo info = queue.getTask(id).orElseThrow();
        while (!info.isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            info = queue.getTask(id).orElseThrow();
        }
        return info;
    }

    @Test
    void syncsStalestFirstAndHonoursLimit() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        List<SyncTarget> targets = List.of(
                SyncTarget.of("600000.SH", "A", LocalDate.of(2024, 6, 10)),
                SyncTarget.of("600001.SH", "B", null),
                SyncTarget.of("600002.SH", "C", LocalDate.of(2024, 5, 1)),
                SyncTarget.of("600003.SH", "D", LocalDate.of(2024, 6, 1)));
        TargetSyncer<String> syncer = new TargetSyncer<>((t, force) -> {
            order.add(t.tsCode());
            return FetchResult.success(List.of("bar"), "incremental");
        }, null);

        TaskInfo info = runJob(new SequentialSyncJob<>(() -> targets, syncer, TargetFilter.tradable(), 10),
                Map.of("limit", 3));

        assertEquals(TaskStatus.SUCCESS, info.status());
        assertEquals(List.of("600001.SH", "600002.SH", "600003.SH"), order);
        assertEquals(3, ((Number) info.result().get("succeededCount")).intValue());
        assertEquals(3, ((Number) info.result().get("total")).intValue());
    }

    @Test
    void itemFailuresDoNotFailTheTask() throws Exception {
        List<SyncTarget> targets = List.of(
                SyncTarget.of("600000.SH", "A", null),
                SyncTarget.of("600001.SH", "B", null));
        TargetSyncer<String> syncer = new TargetSyncer<>((t, force) -> {
            if (t.tsCode().equals("600001.SH")) {
                throw new IllegalStateException("boom");
            }
            return FetchResult.success(List.of(), "full");
        }, null);

        TaskInfo info = runJob(new SequentialSyncJob<>(() -> targets, syncer, TargetFilter.tradable(), 10),
                Map.of("forceFullSync", true));

        assertEquals(TaskStatus.SUCCESS, info.status());
        assertEquals(1, ((Number) info.result().get("failedCount")).intValue());
        assertEquals(Boolean.FALSE, info.result().get("success"));
        List<?> failed = (List<?>) info.result().get("failed");
        assertEquals("600001.SH", ((Map<?, ?>) failed.get(0)).get("tsCode"));
    }

    @Test
    void emptyTargetListSucceedsWithEmptyResult() throws Exception {
        TargetSyncer<String> syncer = new TargetSyncer<>((t, force) -> FetchResult.success(List.of(), "full"), null);

        TaskInfo info = runJob(new SequentialSyncJob<>(List::of, syncer, TargetFilter.tradable(), 10), Map.of());

        assertEquals(TaskStatus.SUCCESS, info.status());
        assertEquals(0, ((Number) info.result().get("total")).intValue());
    }

    @Test
    void invalidLimitFailsTheTask() throws Exception {
        TargetSyncer<String> syncer = new TargetSyncer<>((t, force) -> FetchResult.success(List.of(), "full"), null);
        List<SyncTarget> targets = List.of(SyncTarget.of("600000.SH", "A", null));

        TaskInfo info = runJob(new SequentialSyncJob<>(() -> targets, syncer, TargetFilter.tradable(), 10),
                Map.of("limit", "many"));

        assertEquals(TaskStatus.FAILED, info.status());
        assertTrue(info.error().contains("limit"));
    }
}
