package stocksync.engine.queue;

import stocksync.engine.limiter.RateLimiter;

/**
 * Work executed by a queue worker.
 *
 * <p>The handler reports progress through {@link Task#updateProgress}, polls
 * {@link Task#control()} at safe points, acquires a token from the queue's shared
 * {@link RateLimiter} before each outbound request, stores its result with
 * {@link Task#setResult} and throws on failure.
 */
@FunctionalInterface
public interface TaskHandler {

    void execute(Task task, RateLimiter rateLimiter) throws Exception;
}
