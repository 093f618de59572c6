package stocksync.engine.write;

import stocksync.engine.limiter.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory buffer that tells its producers when a bulk write is due.
 *
 * <p>{@link #add(Object)} never writes; it reports whether the buffer reached the size
 * threshold or the flush interval elapsed. The caller then drains with {@link #getBatch()}
 * and writes outside the buffer lock, so the lock is only held for list operations.
 */
public class BatchWriter<T> {

    private final int batchSize;
    private final long flushIntervalNanos;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private final List<T> buffer = new ArrayList<>();
    private long lastFlushNanos;

    public BatchWriter(int batchSize, Duration flushInterval) {
        this(batchSize, flushInterval, Ticker.SYSTEM);
    }

    public BatchWriter(int batchSize, Duration flushInterval, Ticker ticker) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (flushInterval == null || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must not be negative");
        }
        this.batchSize = batchSize;
        this.flushIntervalNanos = flushInterval.toNanos();
        this.ticker = ticker;
        this.lastFlushNanos = ticker.nanoTime();
    }

    /**
     * Buffer an item.
     *
     * @return true when the caller should drain and write now
     */
    public boolean add(T item) {
        lock.lock();
        try {
            buffer.add(item);

            long now = ticker.nanoTime();
            boolean shouldFlush = buffer.size() >= batchSize
                    || (now - lastFlushNanos) >= flushIntervalNanos;
            if (shouldFlush) {
                lastFlushNanos = now;
            }
            return shouldFlush;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy and clear the buffer; starts a fresh time window.
     */
    public List<T> getBatch() {
        lock.lock();
        try {
            List<T> batch = new ArrayList<>(buffer);
            buffer.clear();
            lastFlushNanos = ticker.nanoTime();
            return batch;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int batchSize() {
        return batchSize;
    }
}
