package stocksync.engine.limiter;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Combines a bounded number of in-flight calls with a minimum interval between
 * consecutive acquisitions.
 *
 * <p>{@link #acquire()} first takes a concurrency slot and then, while holding it, waits
 * out whatever remains of {@code 1/rate} since the previous acquisition. {@link #release()}
 * only returns the slot; the interval timer is untouched.
 */
public class DualLimiter {

    private final int maxConcurrent;
    private final double ratePerSecond;
    private final long minIntervalNanos;
    private final Semaphore slots;
    private final Ticker ticker;
    private final ReentrantLock intervalLock = new ReentrantLock();

    // guarded by intervalLock; Long.MIN_VALUE until the first acquisition
    private long lastAcquireNanos = Long.MIN_VALUE;

    public DualLimiter(int maxConcurrent, double ratePerSecond) {
        this(maxConcurrent, ratePerSecond, Ticker.SYSTEM);
    }

    public DualLimiter(int maxConcurrent, double ratePerSecond, Ticker ticker) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        if (!(ratePerSecond > 0.0) || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException("ratePerSecond must be positive");
        }
        this.maxConcurrent = maxConcurrent;
        this.ratePerSecond = ratePerSecond;
        this.minIntervalNanos = (long) (1_000_000_000d / ratePerSecond);
        this.slots = new Semaphore(maxConcurrent, true);
        this.ticker = ticker;
    }

    public void acquire() throws InterruptedException {
        slots.acquire();
        try {
            awaitInterval();
        } catch (InterruptedException e) {
            slots.release();
            throw e;
        }
    }

    public void release() {
        slots.release();
    }

    /**
     * Acquire and hand back a permit that releases the slot on close.
     */
    public Permit permit() throws InterruptedException {
        acquire();
        return new Permit(this);
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public double ratePerSecond() {
        return ratePerSecond;
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int inFlight() {
        return maxConcurrent - slots.availablePermits();
    }

    private void awaitInterval() throws InterruptedException {
        intervalLock.lockInterruptibly();
        try {
            if (lastAcquireNanos != Long.MIN_VALUE) {
                long sinceLast = ticker.nanoTime() - lastAcquireNanos;
                if (sinceLast < minIntervalNanos) {
                    ticker.sleepNanos(minIntervalNanos - sinceLast);
                }
            }
            lastAcquireNanos = ticker.nanoTime();
        } finally {
            intervalLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "DualLimiter{maxConcurrent=" + maxConcurrent + ", rate=" + ratePerSecond
                + "/s, minInterval=" + TimeUnit.NANOSECONDS.toMillis(minIntervalNanos) + "ms}";
    }

    /**
     * Concurrency slot held for a try-with-resources block.
     */
    public static final class Permit implements AutoCloseable {
        private final DualLimiter owner;
        private boolean released;

        private Permit(DualLimiter owner) {
            this.owner = owner;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                owner.release();
            }
        }
    }
}
