package stocksync.engine.limiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket limiting outbound requests to a steady rate with a bounded burst.
 *
 * <p>Tokens are refilled lazily on every acquisition as
 * {@code min(burst, tokens + elapsed * rate)}; there is no refill thread. A caller that
 * finds too few tokens sleeps in slices of at most one second and recomputes its deficit
 * after every slice. All acquirers of one instance are serialized through a single lock,
 * so service order follows lock hand-off rather than arrival order.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final double ratePerSecond;
    private final int burst;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private double tokens;
    private long lastRefillNanos;

    public RateLimiter(double ratePerSecond, int burst) {
        this(ratePerSecond, burst, Ticker.SYSTEM);
    }

    public RateLimiter(double ratePerSecond, int burst, Ticker ticker) {
        if (!(ratePerSecond > 0.0) || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException("ratePerSecond must be positive");
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1");
        }
        this.ratePerSecond = ratePerSecond;
        this.burst = burst;
        this.ticker = ticker;
        this.tokens = burst;
        this.lastRefillNanos = ticker.nanoTime();
    }

    public double ratePerSecond() {
        return ratePerSecond;
    }

    public int burst() {
        return burst;
    }

    /**
     * Acquire a single token, blocking until it is available.
     */
    public void acquire() throws InterruptedException {
        acquire(1);
    }

    /**
     * Acquire {@code permits} tokens, blocking until enough have accrued.
     *
     * @throws IllegalArgumentException if permits is not in [1, burst]
     */
    public void acquire(int permits) throws InterruptedException {
        if (permits < 1 || permits > burst) {
            throw new IllegalArgumentException("permits must be between 1 and " + burst + ", got " + permits);
        }

        lock.lockInterruptibly();
        try {
            refill();
            long waitedNanos = 0;
            while (tokens < permits) {
                double deficit = permits - tokens;
                long waitNanos = (long) Math.ceil(deficit / ratePerSecond * 1_000_000_000d);
                waitNanos = Math.max(1, Math.min(waitNanos, MAX_WAIT_SLICE_NANOS));

                ticker.sleepNanos(waitNanos);
                waitedNanos += waitNanos;
                refill();
            }
            tokens -= permits;

            if (waitedNanos > 0 && log.isDebugEnabled()) {
                log.debug("Rate limiter granted {} token(s) after {}ms", permits,
                        TimeUnit.NANOSECONDS.toMillis(waitedNanos));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take {@code permits} tokens only if they are available right now.
     */
    public boolean tryAcquire(int permits) {
        if (permits < 1 || permits > burst) {
            throw new IllegalArgumentException("permits must be between 1 and " + burst + ", got " + permits);
        }
        lock.lock();
        try {
            refill();
            if (tokens < permits) {
                return false;
            }
            tokens -= permits;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current token count after a refill; always within [0, burst].
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = ticker.nanoTime();
        long elapsed = now - lastRefillNanos;
        lastRefillNanos = now;
        if (elapsed > 0) {
            tokens = Math.min(burst, tokens + (elapsed / 1_000_000_000d) * ratePerSecond);
        }
    }

    @Override
    public String toString() {
        return "RateLimiter{rate=" + ratePerSecond + "/s, burst=" + burst + "}";
    }
}
