package stocksync.engine.sync;

import stocksync.engine.limiter.Ticker;
import stocksync.engine.queue.CancellationToken;
import stocksync.engine.queue.TaskCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Wraps a fetcher with a per-attempt timeout and linear backoff retries.
 *
 * <p>Each attempt runs on the {@link BlockingCallExecutor}. After a thrown error or
 * timeout the next attempt waits {@code (attempt + 1) * backoffStep}, checking the token
 * every 200 ms of that wait. A result with
 * {@code success == false} is a provider answer, not an error, and is not retried. When
 * every attempt fails the last error is rethrown.
 */
public class RetryingFetcher<T> implements UnitOfWorkFetcher<T> {

    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);

    private static final long BACKOFF_SLICE_MS = 200;

    private final UnitOfWorkFetcher<T> delegate;
    private final BlockingCallExecutor executor;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoffStep;
    private final Ticker ticker;

    public RetryingFetcher(UnitOfWorkFetcher<T> delegate, BlockingCallExecutor executor,
            Duration timeout, int maxRetries, Duration backoffStep) {
        this(delegate, executor, timeout, maxRetries, backoffStep, Ticker.SYSTEM);
    }

    public RetryingFetcher(UnitOfWorkFetcher<T> delegate, BlockingCallExecutor executor,
            Duration timeout, int maxRetries, Duration backoffStep, Ticker ticker) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.backoffStep = backoffStep;
        this.ticker = ticker;
    }

    @Override
    public FetchResult<T> fetch(SyncTarget target, boolean forceFullSync) throws Exception {
        return fetch(target, forceFullSync, CancellationToken.NONE);
    }

    public FetchResult<T> fetch(SyncTarget target, boolean forceFullSync, CancellationToken token)
            throws Exception {
        Exception lastError = null;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            if (token.isCancellationRequested()) {
                throw new TaskCancelledException("Cancelled while fetching " + target.tsCode());
            }
            try {
                return executor.call(() -> delegate.fetch(target, forceFullSync), timeout);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastError = e;
                if (attempt + 1 >= maxRetries) {
                    break;
                }
                Duration wait = backoffStep.multipliedBy(attempt + 1L);
                log.warn("Fetch of {} failed, retrying in {}s ({}/{}): {}",
                        target.tsCode(), wait.toSeconds(), attempt + 1, maxRetries, e.getMessage());
                backoff(wait, target, token);
            }
        }

        throw lastError;
    }

    private void backoff(Duration wait, SyncTarget target, CancellationToken token) throws InterruptedException {
        long remaining = wait.toNanos();
        long slice = TimeUnit.MILLISECONDS.toNanos(BACKOFF_SLICE_MS);
        while (remaining > 0) {
            if (token.isCancellationRequested()) {
                throw new TaskCancelledException("Cancelled while waiting to retry " + target.tsCode());
            }
            long step = Math.min(remaining, slice);
            ticker.sleepNanos(step);
            remaining -= step;
        }
    }

    public int maxRetries() {
        return maxRetries;
    }
}
