package stocksync.engine.batch;

import stocksync.engine.config.SyncConfig;
import stocksync.engine.limiter.RateLimiter;
import stocksync.engine.queue.CancellationToken;
import stocksync.engine.queue.TaskCancelledException;
import stocksync.engine.queue.TaskHandler;
import stocksync.engine.queue.TaskQueue;
import stocksync.engine.repository.BatchProgressRepository;
import stocksync.engine.sync.FreshnessPolicy;
import stocksync.engine.sync.ItemOutcome;
import stocksync.engine.sync.ProgressListener;
import stocksync.engine.sync.SyncRunResult;
import stocksync.engine.sync.SyncTarget;
import stocksync.engine.sync.TargetFilter;
import stocksync.engine.sync.TargetSyncer;
import stocksync.engine.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Splits the eligible targets into prioritized batches and executes them one item at a time.
 *
 * <p>Planning drops targets whose data already reaches the latest trading date (unless a full
 * sync is forced), orders the rest stalest first and chunks them. Execution re-checks each
 * item against the recency window, syncs it through the shared {@link TargetSyncer} and
 * publishes a {@link BatchProgress} snapshot after every item. A failing item is recorded
 * and the batch moves on.
 */
public class BatchSyncManager {

    public static final String KIND = "batch_sync";

    private static final Logger log = LoggerFactory.getLogger(BatchSyncManager.class);
    private static final DateTimeFormatter PREFIX_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int SUMMARY_SAMPLE_SIZE = 10;

    private static final Comparator<BatchItem> STALEST_FIRST = Comparator
            .comparing((BatchItem item) -> item.freshness() == null ? LocalDate.MIN : item.freshness())
            .thenComparing(item -> item.target().tsCode());

    private final SyncConfig config;
    private final TargetSyncer<?> syncer;
    private final FreshnessPolicy freshness;
    private final TargetFilter filter;
    private final BatchProgressRepository progressStore;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    /**
     * @param rateLimiter limiter for synchronous batch runs; pass the task queue's limiter so
     *                    direct and queued runs share one request budget
     */
    public BatchSyncManager(SyncConfig config, TargetSyncer<?> syncer, FreshnessPolicy freshness,
            TargetFilter filter, BatchProgressRepository progressStore, RateLimiter rateLimiter, Clock clock) {
        this.config = config;
        this.syncer = syncer;
        this.freshness = freshness;
        this.filter = filter;
        this.progressStore = progressStore;
        this.clock = clock;
        this.rateLimiter = rateLimiter;
    }

    // ---- Planning ----

    /**
     * Plan with the configured batch size and a fresh timestamp prefix.
     */
    public BatchPlan createBatches(List<SyncTarget> targets, boolean forceFullSync) {
        return createBatches(targets, forceFullSync, config.batchSize(), null);
    }

    /**
     * Plan the batches. The same input with the same prefix always yields the same plan.
     *
     * @param prefix id prefix to reuse, or null to derive one from the current time
     */
    public BatchPlan createBatches(List<SyncTarget> targets, boolean forceFullSync, int batchSize, String prefix) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        String batchPrefix = prefix == null || prefix.isBlank()
                ? LocalDateTime.now(clock).format(PREFIX_FORMAT)
                : prefix;

        List<SyncTarget> eligible = filter.apply(targets);
        List<BatchItem> items = new ArrayList<>(eligible.size());
        int skippedFresh = 0;

        if (forceFullSync) {
            eligible.forEach(t -> items.add(BatchItem.of(t)));
        } else {
            LocalDate latestTradeDate = freshness.latestTradeDate();
            for (SyncTarget target : eligible) {
                if (freshness.isUpToDate(target.latestDate(), latestTradeDate)) {
                    skippedFresh++;
                } else {
                    items.add(BatchItem.of(target));
                }
            }
            log.info("Freshness filter (latest trade date {}): {} eligible, {} to sync, {} skipped",
                    latestTradeDate, eligible.size(), items.size(), skippedFresh);
        }

        items.sort(STALEST_FIRST);

        int totalBatches = (items.size() + batchSize - 1) / batchSize;
        Instant createdAt = clock.instant();
        List<Batch> batches = new ArrayList<>(totalBatches);
        for (int start = 0; start < items.size(); start += batchSize) {
            int index = batches.size() + 1;
            List<BatchItem> chunk = items.subList(start, Math.min(start + batchSize, items.size()));
            batches.add(new Batch(batchPrefix + "_" + index, index, totalBatches, chunk,
                    BatchStatus.PENDING, createdAt));
        }

        log.info("Created {} batch(es) of up to {} target(s), prefix {}", batches.size(), batchSize, batchPrefix);
        return new BatchPlan(batchPrefix, batches, skippedFresh, eligible.size());
    }

    // ---- Execution ----

    /**
     * Execute a batch on the calling thread with the shared rate limiter.
     */
    public BatchResult executeBatch(Batch batch, boolean forceFullSync) throws InterruptedException {
        return executeBatch(batch, forceFullSync, rateLimiter, CancellationToken.NONE, ProgressListener.NONE);
    }

    /**
     * Rebuild the plan with a known prefix and execute its {@code batchIndex}-th batch.
     *
     * @throws IllegalArgumentException if the plan has no batch with that index
     */
    public BatchResult executeBatch(String prefix, int batchIndex, List<SyncTarget> targets, boolean forceFullSync)
            throws InterruptedException {
        Batch batch = findBatch(prefix, batchIndex, targets, forceFullSync);
        return executeBatch(batch, forceFullSync);
    }

    public BatchResult executeBatch(Batch batch, boolean forceFullSync, RateLimiter limiter,
            CancellationToken token, ProgressListener listener) throws InterruptedException {
        String batchId = batch.batchId();
        int total = batch.itemCount();
        String header = String.format("[Batch %d/%d]", batch.batchIndex(), batch.totalBatches());

        log.info("Starting batch {} with {} target(s)", batchId, total);
        progressStore.save(BatchProgress.builder()
                .batchId(batchId)
                .batchIndex(batch.batchIndex())
                .totalBatches(batch.totalBatches())
                .totalCount(total)
                .status(BatchStatus.RUNNING)
                .startTime(clock.instant())
                .message(String.format("Preparing batch %d/%d", batch.batchIndex(), batch.totalBatches()))
                .build());

        SyncRunResult.Collector collector = new SyncRunResult.Collector(config.failureSampleSize());
        boolean cancelled = false;

        try {
            int i = 0;
            for (BatchItem item : batch.items()) {
                i++;
                if (!token.checkpoint()) {
                    cancelled = true;
                    break;
                }

                SyncTarget target = item.target();
                double progress = round2((i - 1) * 100.0 / total);
                String message = String.format("%s [%d/%d] Syncing %s", header, i, total, target.label());
                int index = i;

                listener.onProgress(progress, message);
                progressStore.update(batchId, p -> p.toBuilder()
                        .currentIndex(index)
                        .currentItem(target.tsCode(), target.name())
                        .progress(progress)
                        .message(message)
                        .build());
                log.info(message);

                ItemOutcome outcome;
                if (!forceFullSync && freshness.isRecentlySynced(item.freshness())) {
                    log.info("  skipped, data is recent: {}", item.freshness());
                    outcome = ItemOutcome.skipped(target);
                } else {
                    outcome = syncer.sync(target, forceFullSync, limiter, token);
                }
                collector.add(outcome);
                publishCounts(batchId, collector);
            }
        } catch (TaskCancelledException e) {
            cancelled = true;
        } catch (InterruptedException e) {
            finish(batch, collector, true);
            throw e;
        } finally {
            syncer.drain();
        }

        return finish(batch, collector, cancelled);
    }

    private BatchResult finish(Batch batch, SyncRunResult.Collector collector, boolean cancelled) {
        int succeeded = collector.succeededCount();
        int failed = collector.failedCount();
        int skipped = collector.skippedCount();

        BatchStatus status;
        if (cancelled) {
            status = BatchStatus.CANCELLED;
        } else {
            status = failed == 0 ? BatchStatus.COMPLETED : BatchStatus.COMPLETED_WITH_ERRORS;
        }
        String summary = String.format("Batch %d %s: %d succeeded, %d failed, %d skipped",
                batch.batchIndex(), cancelled ? "cancelled" : "finished", succeeded, failed, skipped);

        progressStore.update(batch.batchId(), p -> {
            BatchProgress.Builder builder = p.toBuilder()
                    .status(status)
                    .succeededCount(succeeded)
                    .failedCount(failed)
                    .skippedCount(skipped)
                    .message(summary)
                    .endTime(clock.instant());
            if (!cancelled) {
                builder.currentIndex(batch.itemCount()).progress(100.0);
            }
            return builder.build();
        });

        log.info("Batch {}: {}", batch.batchId(), summary);
        return new BatchResult(batch.batchId(), batch.batchIndex(), batch.totalBatches(),
                failed == 0 && !cancelled, status, summary, batch.itemCount(), skipped,
                succeeded, failed, collector.succeededSample(), collector.failedSample());
    }

    private void publishCounts(String batchId, SyncRunResult.Collector collector) {
        int succeeded = collector.succeededCount();
        int failed = collector.failedCount();
        int skipped = collector.skippedCount();
        progressStore.update(batchId, p -> p.toBuilder()
                .succeededCount(succeeded)
                .failedCount(failed)
                .skippedCount(skipped)
                .build());
    }

    // ---- Queue integration ----

    /**
     * Run a batch as a queue task so it can be paused, cancelled and polled by task id as well
     * as by batch id.
     */
    public String submitBatch(TaskQueue queue, Batch batch, boolean forceFullSync) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("batchId", batch.batchId());
        params.put("batchIndex", batch.batchIndex());
        params.put("totalBatches", batch.totalBatches());
        params.put("forceFullSync", forceFullSync);

        return queue.submit(KIND, params, (task, limiter) -> {
            BatchResult result = executeBatch(batch, forceFullSync, limiter, task.control(),
                    task::updateProgress);
            task.setResult(Json.toMap(result));
            if (result.status() != BatchStatus.CANCELLED) {
                task.updateProgress(100.0, result.message());
            }
        });
    }

    /**
     * Handler for {@link stocksync.engine.model.JobDescriptor}s of kind {@value #KIND}.
     * Parameters: {@code prefix}, {@code batchIndex}, {@code forceFullSync}.
     */
    public TaskHandler asHandler(Supplier<List<SyncTarget>> targetSource) {
        return (task, limiter) -> {
            Map<String, Object> params = task.params();
            Object prefix = params.get("prefix");
            Object index = params.get("batchIndex");
            if (prefix == null || index == null) {
                throw new IllegalArgumentException("prefix and batchIndex are required");
            }
            boolean forceFullSync = Boolean.TRUE.equals(params.get("forceFullSync"));
            Batch batch = findBatch(prefix.toString(), Integer.parseInt(index.toString()),
                    targetSource.get(), forceFullSync);

            BatchResult result = executeBatch(batch, forceFullSync, limiter, task.control(),
                    task::updateProgress);
            task.setResult(Json.toMap(result));
        };
    }

    private Batch findBatch(String prefix, int batchIndex, List<SyncTarget> targets, boolean forceFullSync) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix is required");
        }
        BatchPlan plan = createBatches(targets, forceFullSync, config.batchSize(), prefix);
        return plan.batch(batchIndex).orElseThrow(() -> new IllegalArgumentException(
                "Batch " + batchIndex + " does not exist (plan has " + plan.batches().size() + ")"));
    }

    // ---- Queries ----

    /**
     * How many eligible targets need an update, computed fresh on every call.
     */
    public SyncProgressSummary getSyncProgress(List<SyncTarget> targets) {
        List<SyncTarget> eligible = filter.apply(targets);
        LocalDate latestTradeDate = freshness.latestTradeDate();

        List<SyncProgressSummary.Entry> needUpdate = new ArrayList<>();
        List<SyncProgressSummary.Entry> upToDate = new ArrayList<>();
        int needCount = 0;
        int upCount = 0;
        for (SyncTarget target : eligible) {
            SyncProgressSummary.Entry entry =
                    new SyncProgressSummary.Entry(target.tsCode(), target.name(), target.latestDate());
            if (freshness.isUpToDate(target.latestDate(), latestTradeDate)) {
                upCount++;
                if (upToDate.size() < SUMMARY_SAMPLE_SIZE) {
                    upToDate.add(entry);
                }
            } else {
                needCount++;
                if (needUpdate.size() < SUMMARY_SAMPLE_SIZE) {
                    needUpdate.add(entry);
                }
            }
        }
        return new SyncProgressSummary(eligible.size(), needCount, upCount, latestTradeDate, needUpdate, upToDate);
    }

    public Optional<BatchProgress> getBatchExecutionProgress(String batchId) {
        return progressStore.findById(batchId);
    }

    public List<BatchProgress> getAllBatchProgress() {
        return progressStore.findAll();
    }

    public boolean clearBatchProgress(String batchId) {
        return progressStore.delete(batchId);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
