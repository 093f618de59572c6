package stocksync.engine.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded thread pool for blocking provider calls, so they never run on a queue worker
 * for longer than their timeout.
 */
public class BlockingCallExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlockingCallExecutor.class);

    private final ExecutorService pool;
    private final int poolSize;

    public BlockingCallExecutor(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        this.poolSize = poolSize;
        AtomicInteger index = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "blocking-call-" + index.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run a blocking call on the pool and wait at most {@code timeout} for it.
     *
     * @throws FetchTimeoutException if the call did not finish in time; the call is
     *                               interrupted
     * @throws Exception             whatever the call itself threw
     */
    public <T> T call(Callable<T> callable, Duration timeout) throws Exception {
        Future<T> future = pool.submit(callable);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchTimeoutException(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    public int poolSize() {
        return poolSize;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("Blocking call pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
