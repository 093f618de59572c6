package stocksync.engine.sync;

import stocksync.engine.config.SyncConfig;
import stocksync.engine.config.SyncMode;
import stocksync.engine.limiter.DualLimiter;
import stocksync.engine.queue.CancellationToken;
import stocksync.engine.queue.TaskHandler;
import stocksync.engine.util.Json;
import stocksync.engine.write.BatchWriter;
import stocksync.engine.write.BufferedFlusher;
import stocksync.engine.write.FlushSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * High-throughput sync: many targets in flight at once.
 *
 * <p>Each item holds a {@link DualLimiter} slot for the duration of its fetch and is paced
 * by the limiter's minimum interval. Fetched rows go through a {@link BufferedFlusher} and
 * whatever is left is written once all items finish. Cancel and pause are honoured before
 * each item starts.
 */
public class ConcurrentSyncService<T> {

    public static final String KIND = "kline_sync_concurrent";

    private static final Logger log = LoggerFactory.getLogger(ConcurrentSyncService.class);

    private final UnitOfWorkFetcher<T> fetcher;
    private final SyncConfig config;
    private final TargetFilter filter;

    public ConcurrentSyncService(UnitOfWorkFetcher<T> fetcher, SyncConfig config, TargetFilter filter) {
        this.fetcher = fetcher;
        this.config = config;
        this.filter = filter;
    }

    /**
     * Sync targets with the concurrency and rate of {@code mode}.
     */
    public SyncRunResult syncAll(List<SyncTarget> targets, SyncMode mode, FlushSink<FetchedRows<T>> sink,
            CancellationToken token, ProgressListener listener) throws InterruptedException {
        return syncAll(targets, new DualLimiter(mode.maxConcurrent(), mode.concurrentRatePerSecond()),
                mode.forceFullSync(), sink, token, listener);
    }

    /**
     * Sync targets with the concurrency and rate configured in {@link SyncConfig}.
     */
    public SyncRunResult syncAll(List<SyncTarget> targets, boolean forceFullSync, FlushSink<FetchedRows<T>> sink,
            CancellationToken token, ProgressListener listener) throws InterruptedException {
        return syncAll(targets, configuredLimiter(), forceFullSync, sink, token, listener);
    }

    public SyncRunResult syncAll(List<SyncTarget> targets, DualLimiter limiter, boolean forceFullSync,
            FlushSink<FetchedRows<T>> sink, CancellationToken token, ProgressListener listener)
            throws InterruptedException {
        List<SyncTarget> eligible = filter.apply(targets);
        int total = eligible.size();
        if (total == 0) {
            return SyncRunResult.empty("No targets to sync");
        }

        log.info("Starting concurrent sync of {} target(s) with {}", total, limiter);

        BufferedFlusher<FetchedRows<T>> flusher = new BufferedFlusher<>(
                new BatchWriter<>(config.writerBatchSize(), config.writerFlushInterval()), sink);
        SyncRunResult.Collector collector = new SyncRunResult.Collector(config.failureSampleSize());
        AtomicInteger done = new AtomicInteger();

        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(limiter.maxConcurrent(), r -> {
            Thread t = new Thread(r, "concurrent-sync-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<ItemOutcome>> futures = new ArrayList<>(total);
            for (SyncTarget target : eligible) {
                futures.add(pool.submit(() -> syncSingle(target, forceFullSync, limiter, flusher,
                        token, listener, done, total)));
            }

            for (Future<ItemOutcome> future : futures) {
                try {
                    collector.add(future.get());
                } catch (ExecutionException e) {
                    collector.addException();
                    log.error("Concurrent sync item raised", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
            pool.awaitTermination(30, TimeUnit.SECONDS);
            flusher.drain();
        }

        SyncRunResult result = collector.build(total, token.isCancellationRequested());
        log.info("Concurrent sync finished: {} ({} row chunk(s) written, {} failed write(s))",
                result.message(), flusher.flushCount(), flusher.failedFlushes());
        return result;
    }

    private ItemOutcome syncSingle(SyncTarget target, boolean forceFullSync, DualLimiter limiter,
            BufferedFlusher<FetchedRows<T>> flusher, CancellationToken token, ProgressListener listener,
            AtomicInteger done, int total) throws InterruptedException {
        if (token.isCancellationRequested()) {
            return ItemOutcome.skipped(target);
        }
        token.awaitIfPaused();

        limiter.acquire();
        try {
            FetchResult<T> result = fetcher.fetch(target, forceFullSync);
            if (!result.success()) {
                return ItemOutcome.failed(target, result.message());
            }
            if (!result.data().isEmpty()) {
                flusher.offer(new FetchedRows<>(target.tsCode(), result.data()));
            }
            return ItemOutcome.succeeded(target, result.count(), result.syncMode());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Sync of {} failed: {}", target.tsCode(), e.getMessage());
            return ItemOutcome.failed(target, e.getMessage());
        } finally {
            limiter.release();
            int finished = done.incrementAndGet();
            listener.onProgress(finished * 100.0 / total,
                    String.format("Processed %d/%d targets", finished, total));
        }
    }

    DualLimiter configuredLimiter() {
        return new DualLimiter(config.maxConcurrent(), config.concurrentRatePerSecond());
    }

    /**
     * Queue handler running this service. Parameter {@code mode}: "init" or "daily" picks
     * that mode's profile. Without it the configured concurrency and rate apply and
     * {@code forceFullSync} is read from the params.
     */
    public TaskHandler asHandler(Supplier<List<SyncTarget>> targetSource, FlushSink<FetchedRows<T>> sink) {
        return (task, rateLimiter) -> {
            Object modeParam = task.params().get("mode");
            SyncRunResult result;
            if (modeParam == null) {
                boolean forceFull = Boolean.parseBoolean(String.valueOf(task.params().get("forceFullSync")));
                result = syncAll(targetSource.get(), forceFull, sink, task.control(), task::updateProgress);
            } else {
                result = syncAll(targetSource.get(), SyncMode.fromName(modeParam.toString()), sink,
                        task.control(), task::updateProgress);
            }
            task.setResult(Json.toMap(result));
        };
    }

}
