package stocksync.engine.batch;

import stocksync.engine.config.SyncConfig;
import stocksync.engine.limiter.RateLimiter;
import stocksync.engine.model.TaskInfo;
import stocksync.engine.model.TaskStatus;
import stocksync.engine.queue.CancellationToken;
import stocksync.engine.queue.TaskControl;
import stocksync.engine.queue.TaskHandlerRegistry;
import stocksync.engine.queue.TaskQueue;
import stocksync.engine.store.InMemoryBatchProgressRepository;
import stocksync.engine.store.InMemoryTaskRepository;
import stocksync.engine.sync.FetchResult;
import stocksync.engine.sync.FreshnessPolicy;
import stocksync.engine.sync.ProgressListener;
import stocksync.engine.sync.SyncTarget;
import stocksync.engine.sync.TargetFilter;
import stocksync.engine.sync.TargetSyncer;
import stocksync.engine.sync.TradingCalendar;
import stocksync.engine.sync.UnitOfWorkFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Planning and execution of prioritized batches.
 */
class BatchSyncManagerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 12);
    private static final LocalDate LATEST_TRADE_DATE = LocalDate.of(2024, 6, 11);

    private final Clock clock = Clock.fixed(TODAY.atTime(15, 30).toInstant(ZoneOffset.UTC), ZoneId.of("UTC"));
    private final SyncConfig config = SyncConfig.defaults().withQueueRate(1000.0, 10);
    private final InMemoryBatchProgressRepository store = new InMemoryBatchProgressRepository();

    private BatchSyncManager manager(UnitOfWorkFetcher<String> fetcher) {
        FreshnessPolicy freshness = new FreshnessPolicy(
                new TradingCalendar(clock, () -> Optional.of(LATEST_TRADE_DATE)), 7);
        return new BatchSyncManager(config, new TargetSyncer<>(fetcher, null), freshness,
                TargetFilter.tradable(), store, new RateLimiter(1000.0, 10), clock);
    }

    private static UnitOfWorkFetcher<String> alwaysOk() {
        return (t, force) -> FetchResult.success(List.of("bar"), force ? "full" : "incremental");
    }

    private static List<SyncTarget> targets(int n) {
        List<SyncTarget> list = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            list.add(SyncTarget.of(String.format("60000%d.SH", i), "T" + i, null));
        }
        return list;
    }

    // ---- Planning ----

    @Test
    void chunksIntoNumberedBatches() {
        BatchPlan plan = manager(alwaysOk()).createBatches(targets(5), false, 2, "20240612_090000");

        assertEquals("20240612_090000", plan.prefix());
        assertEquals(3, plan.batches().size());
        assertEquals("20240612_090000_1", plan.batches().get(0).batchId());
        assertEquals("20240612_090000_3", plan.batches().get(2).batchId());
        assertEquals(1, plan.batches().get(2).itemCount());
        assertTrue(plan.batches().stream().allMatch(b -> b.totalBatches() == 3));
        assertTrue(plan.batches().stream().allMatch(b -> b.status() == BatchStatus.PENDING));
        assertEquals(5, plan.plannedTargets());
    }

    @Test
    void generatedPrefixUsesTimestamp() {
        BatchPlan plan = manager(alwaysOk()).createBatches(targets(1), false);

        assertEquals("20240612_153000", plan.prefix());
        assertEquals("20240612_153000_1", plan.batches().get(0).batchId());
    }

    @Test
    @DisplayName("Planning is deterministic for a fixed input and prefix")
    void planningIsDeterministic() {
        List<SyncTarget> input = new ArrayList<>(List.of(
                SyncTarget.of("600003.SH", "C", LocalDate.of(2024, 5, 1)),
                SyncTarget.of("600001.SH", "A", null),
                SyncTarget.of("600002.SH", "B", LocalDate.of(2024, 5, 1)),
                SyncTarget.of("600004.SH", "D", LocalDate.of(2024, 6, 3))));
        BatchSyncManager manager = manager(alwaysOk());

        BatchPlan first = manager.createBatches(input, false, 2, "p");
        Collections.reverse(input);
        BatchPlan second = manager.createBatches(input, false, 2, "p");

        assertEquals(codes(first), codes(second));
        // unknown freshness first, then oldest, ties by code
        assertEquals(List.of("600001.SH", "600002.SH", "600003.SH", "600004.SH"), codes(first));
    }

    @Test
    void skipsTargetsAlreadyAtLatestTradeDate() {
        List<SyncTarget> input = List.of(
                SyncTarget.of("600001.SH", "fresh", LATEST_TRADE_DATE),
                SyncTarget.of("600002.SH", "stale", LocalDate.of(2024, 6, 7)),
                SyncTarget.of("600003.SH", "ST flagged", null));

        BatchPlan plan = manager(alwaysOk()).createBatches(input, false, 500, "p");

        assertEquals(List.of("600002.SH"), codes(plan));
        assertEquals(1, plan.skippedFresh());
        assertEquals(2, plan.totalTargets());

        BatchPlan forced = manager(alwaysOk()).createBatches(input, true, 500, "p");
        assertEquals(List.of("600002.SH", "600001.SH"), codes(forced));
        assertEquals(0, forced.skippedFresh());
    }

    @Test
    void emptyInputGivesEmptyPlan() {
        BatchPlan plan = manager(alwaysOk()).createBatches(List.of(), false, 10, "p");

        assertTrue(plan.isEmpty());
        assertTrue(plan.batch(1).isEmpty());
    }

    @Test
    void rejectsInvalidBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> manager(alwaysOk()).createBatches(targets(1), false, 0, "p"));
    }

    // ---- Execution ----

    @Test
    @DisplayName("One failing item out of five: batch completes with errors")
    void failingItemDoesNotAbortBatch() throws Exception {
        BatchSyncManager manager = manager((t, force) -> {
            if (t.tsCode().equals("600003.SH")) {
                throw new IllegalStateException("provider error");
            }
            return FetchResult.success(List.of("bar"), "incremental");
        });
        Batch batch = manager.createBatches(targets(5), false, 500, "p").batches().get(0);

        BatchResult result = manager.executeBatch(batch, false);

        assertEquals(4, result.succeededCount());
        assertEquals(1, result.failedCount());
        assertEquals(BatchStatus.COMPLETED_WITH_ERRORS, result.status());
        assertFalse(result.success());
        assertEquals("IllegalStateException: provider error", result.failed().get(0).error());

        BatchProgress progress = manager.getBatchExecutionProgress("p_1").orElseThrow();
        assertEquals(BatchStatus.COMPLETED_WITH_ERRORS, progress.status());
        assertEquals(100.0, progress.progress());
        assertEquals(5, progress.currentIndex());
        assertEquals(4, progress.succeededCount());
        assertEquals(1, progress.failedCount());
        assertNotNull(progress.startTime());
        assertNotNull(progress.endTime());
    }

    @Test
    void cleanBatchCompletes() throws Exception {
        BatchSyncManager manager = manager(alwaysOk());
        Batch batch = manager.createBatches(targets(3), false, 500, "p").batches().get(0);

        BatchResult result = manager.executeBatch(batch, false);

        assertTrue(result.success());
        assertEquals(BatchStatus.COMPLETED, result.status());
        assertEquals(BatchStatus.COMPLETED, manager.getBatchExecutionProgress("p_1").orElseThrow().status());
    }

    @Test
    void recentlySyncedItemsAreSkippedUnlessForced() throws Exception {
        List<String> fetched = new CopyOnWriteArrayList<>();
        BatchSyncManager manager = manager((t, force) -> {
            fetched.add(t.tsCode());
            return FetchResult.success(List.of(), "incremental");
        });
        // stale for planning (before the latest trade date) but inside the 7 day window
        List<SyncTarget> input = List.of(
                SyncTarget.of("600001.SH", "recent", LocalDate.of(2024, 6, 8)),
                SyncTarget.of("600002.SH", "old", LocalDate.of(2024, 5, 1)));
        Batch batch = manager.createBatches(input, false, 500, "p").batches().get(0);

        BatchResult result = manager.executeBatch(batch, false);

        assertEquals(List.of("600002.SH"), fetched);
        assertEquals(1, result.skipped());
        assertEquals(1, result.succeededCount());

        fetched.clear();
        manager.executeBatch(batch, true);
        assertEquals(2, fetched.size());
    }

    @Test
    void progressIsPublishedWhileRunning() throws Exception {
        List<Integer> observedIndex = new CopyOnWriteArrayList<>();
        BatchSyncManager[] holder = new BatchSyncManager[1];
        holder[0] = manager((t, force) -> {
            BatchProgress live = holder[0].getBatchExecutionProgress("p_1").orElseThrow();
            assertEquals(BatchStatus.RUNNING, live.status());
            assertEquals(t.tsCode(), live.currentTsCode());
            observedIndex.add(live.currentIndex());
            return FetchResult.success(List.of(), "incremental");
        });
        Batch batch = holder[0].createBatches(targets(3), false, 500, "p").batches().get(0);
        List<Double> reported = new CopyOnWriteArrayList<>();

        holder[0].executeBatch(batch, false, new RateLimiter(1000.0, 10),
                CancellationToken.NONE, (percent, message) -> reported.add(percent));

        assertEquals(List.of(1, 2, 3), observedIndex);
        assertEquals(List.of(0.0, 33.33, 66.67), reported);
    }

    @Test
    void cancellationStopsBetweenItems() throws Exception {
        TaskControl control = new TaskControl();
        List<String> fetched = new CopyOnWriteArrayList<>();
        BatchSyncManager manager = manager((t, force) -> {
            fetched.add(t.tsCode());
            if (fetched.size() == 2) {
                control.requestCancel();
            }
            return FetchResult.success(List.of(), "incremental");
        });
        Batch batch = manager.createBatches(targets(5), false, 500, "p").batches().get(0);

        BatchResult result = manager.executeBatch(batch, false, new RateLimiter(1000.0, 10),
                control, ProgressListener.NONE);

        assertEquals(2, fetched.size());
        assertEquals(BatchStatus.CANCELLED, result.status());
        assertEquals(BatchStatus.CANCELLED, manager.getBatchExecutionProgress("p_1").orElseThrow().status());
    }

    @Test
    void executeByPrefixAndIndex() throws Exception {
        BatchSyncManager manager = manager(alwaysOk());

        BatchResult result = manager.executeBatch("p", 1, targets(2), false);

        assertEquals("p_1", result.batchId());
        assertEquals(2, result.succeededCount());
        assertThrows(IllegalArgumentException.class, () -> manager.executeBatch("p", 2, targets(2), false));
    }

    // ---- Queries ----

    @Test
    void unknownBatchIdHasNoProgress() {
        assertTrue(manager(alwaysOk()).getBatchExecutionProgress("nope").isEmpty());
    }

    @Test
    void clearRemovesProgress() throws Exception {
        BatchSyncManager manager = manager(alwaysOk());
        manager.executeBatch("p", 1, targets(1), false);

        assertTrue(manager.clearBatchProgress("p_1"));
        assertTrue(manager.getBatchExecutionProgress("p_1").isEmpty());
        assertFalse(manager.clearBatchProgress("p_1"));
    }

    @Test
    void syncProgressSummaryCountsFreshness() {
        List<SyncTarget> input = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            input.add(SyncTarget.of("60010" + (char) ('a' + i), "N" + i, null));
        }
        input.add(SyncTarget.of("600200.SH", "fresh", LATEST_TRADE_DATE));

        SyncProgressSummary summary = manager(alwaysOk()).getSyncProgress(input);

        assertEquals(13, summary.totalTargets());
        assertEquals(12, summary.needUpdate());
        assertEquals(1, summary.upToDate());
        assertEquals(10, summary.needUpdateSample().size());
        assertEquals(LATEST_TRADE_DATE, summary.latestTradeDate());
    }

    // ---- Queue integration ----

    @Test
    void submittedBatchRunsAsQueueTask() throws Exception {
        BatchSyncManager manager = manager(alwaysOk());
        Batch batch = manager.createBatches(targets(3), false, 500, "q").batches().get(0);

        try (TaskQueue queue = new TaskQueue("batch", 1, new RateLimiter(1000.0, 10),
                new InMemoryTaskRepository(), new TaskHandlerRegistry(), Duration.ofSeconds(1))) {
            String taskId = manager.submitBatch(queue, batch, false);

            long deadline = System.currentTimeMillis() + 5000;
            TaskInfo info = queue.getTask(taskId).orElseThrow();
            while (!info.isTerminal() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
                info = queue.getTask(taskId).orElseThrow();
            }

            assertEquals(TaskStatus.SUCCESS, info.status());
            assertEquals(BatchSyncManager.KIND, info.type());
            assertEquals("q_1", info.result().get("batchId"));
            assertEquals("completed", info.result().get("status"));
        }
        assertEquals(BatchStatus.COMPLETED, manager.getBatchExecutionProgress("q_1").orElseThrow().status());
    }

    private static List<String> codes(BatchPlan plan) {
        return plan.batches().stream()
                .flatMap(b -> b.items().stream())
                .map(item -> item.target().tsCode())
                .toList();
    }
}
