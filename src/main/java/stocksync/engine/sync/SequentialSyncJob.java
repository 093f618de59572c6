package stocksync.engine.sync;

import stocksync.engine.limiter.RateLimiter;
import stocksync.engine.queue.Task;
import stocksync.engine.queue.TaskHandler;
import stocksync.engine.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Queue handler that syncs every eligible target one after another, stalest first,
 * pacing each request through the queue's shared rate limiter.
 *
 * <p>Parameters: {@code limit} (max targets, after prioritization) and
 * {@code forceFullSync}. The task result is a {@link SyncRunResult} map.
 */
public class SequentialSyncJob<T> implements TaskHandler {

    public static final String KIND = "kline_sync";

    private static final Logger log = LoggerFactory.getLogger(SequentialSyncJob.class);

    private final Supplier<List<SyncTarget>> targetSource;
    private final TargetSyncer<T> syncer;
    private final TargetFilter filter;
    private final int failureSampleSize;

    public SequentialSyncJob(Supplier<List<SyncTarget>> targetSource, TargetSyncer<T> syncer,
            TargetFilter filter, int failureSampleSize) {
        this.targetSource = targetSource;
        this.syncer = syncer;
        this.filter = filter;
        this.failureSampleSize = failureSampleSize;
    }

    @Override
    public void execute(Task task, RateLimiter rateLimiter) throws Exception {
        Map<String, Object> params = task.params();
        Integer limit = intParam(params, "limit");
        boolean forceFullSync = Boolean.TRUE.equals(params.get("forceFullSync"));

        List<SyncTarget> ordered = prioritize(filter.apply(targetSource.get()));
        if (limit != null && limit >= 0 && ordered.size() > limit) {
            ordered = ordered.subList(0, limit);
        }

        if (ordered.isEmpty()) {
            task.updateProgress(100.0, "No targets to sync");
            task.setResult(Json.toMap(SyncRunResult.empty("No targets to sync")));
            return;
        }

        int total = ordered.size();
        SyncRunResult.Collector collector = new SyncRunResult.Collector(failureSampleSize);
        boolean cancelled = false;

        try {
            for (int i = 0; i < total; i++) {
                if (!task.control().checkpoint()) {
                    cancelled = true;
                    break;
                }

                SyncTarget target = ordered.get(i);
                String message = String.format("[%d/%d] Syncing %s (latest data: %s)...",
                        i + 1, total, target.label(), target.latestDate());
                task.updateProgress(i * 100.0 / total, message);
                log.info(message);

                collector.add(syncer.sync(target, forceFullSync, rateLimiter, task.control()));
            }
        } finally {
            syncer.drain();
        }

        SyncRunResult result = collector.build(total, cancelled);
        task.setResult(Json.toMap(result));
        if (!cancelled) {
            task.updateProgress(100.0, result.message());
        }
        log.info("Sequential sync of task {}: {}", task.id(), result.message());
    }

    /** Stalest first; never-synced targets lead. Ties broken by code. */
    static List<SyncTarget> prioritize(List<SyncTarget> targets) {
        List<SyncTarget> sorted = new ArrayList<>(targets);
        sorted.sort(Comparator
                .comparing((SyncTarget t) -> t.latestDate() == null ? LocalDate.MIN : t.latestDate())
                .thenComparing(SyncTarget::tsCode));
        return sorted;
    }

    private static Integer intParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an integer: " + value);
        }
    }
}
