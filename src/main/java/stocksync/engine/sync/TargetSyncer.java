package stocksync.engine.sync;

import stocksync.engine.limiter.RateLimiter;
import stocksync.engine.queue.CancellationToken;
import stocksync.engine.queue.TaskCancelledException;
import stocksync.engine.write.BufferedFlusher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single-item sync path shared by queue jobs and batch execution:
 * take a rate limiter token, fetch, and hand fetched rows to the write buffer.
 *
 * <p>Errors of the fetch are caught here and reported as a failed {@link ItemOutcome};
 * only interruption and cancellation escape.
 */
public class TargetSyncer<T> {

    private static final Logger log = LoggerFactory.getLogger(TargetSyncer.class);

    private final UnitOfWorkFetcher<T> fetcher;
    private final BufferedFlusher<FetchedRows<T>> flusher;

    /**
     * @param fetcher the fetch, usually a {@link RetryingFetcher}
     * @param flusher write buffer for fetched rows, or null to discard payloads
     */
    public TargetSyncer(UnitOfWorkFetcher<T> fetcher, BufferedFlusher<FetchedRows<T>> flusher) {
        this.fetcher = fetcher;
        this.flusher = flusher;
    }

    public ItemOutcome sync(SyncTarget target, boolean forceFullSync, RateLimiter limiter,
            CancellationToken token) throws InterruptedException {
        limiter.acquire();

        FetchResult<T> result;
        try {
            if (fetcher instanceof RetryingFetcher<T> retrying) {
                result = retrying.fetch(target, forceFullSync, token);
            } else {
                result = fetcher.fetch(target, forceFullSync);
            }
        } catch (InterruptedException | TaskCancelledException e) {
            throw e;
        } catch (Exception e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Sync of {} failed: {}", target.tsCode(), error, e);
            return ItemOutcome.failed(target, error);
        }

        if (result == null || !result.success()) {
            String message = result == null ? "No result" : result.message();
            log.warn("Sync of {} unsuccessful: {}", target.tsCode(), message);
            return ItemOutcome.failed(target, message);
        }

        if (flusher != null && !result.data().isEmpty()) {
            flusher.offer(new FetchedRows<>(target.tsCode(), result.data()));
        }
        return ItemOutcome.succeeded(target, result.count(), result.syncMode());
    }

    /**
     * Write whatever the buffer still holds.
     */
    public void drain() {
        if (flusher != null) {
            flusher.drain();
        }
    }

    public BufferedFlusher<FetchedRows<T>> flusher() {
        return flusher;
    }
}
