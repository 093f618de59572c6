package stocksync.engine.queue;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Per-task control: a one-way cancel flag and a pause flag with a wait primitive.
 * Owned by exactly one task.
 */
public final class TaskControl implements CancellationToken {

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition unpaused = lock.newCondition();
    private volatile boolean paused;

    /**
     * Request cancellation. Idempotent; also wakes an executor blocked in a pause.
     *
     * @return true if this call flipped the flag
     */
    public boolean requestCancel() {
        boolean flipped = cancelRequested.compareAndSet(false, true);
        lock.lock();
        try {
            unpaused.signalAll();
        } finally {
            lock.unlock();
        }
        return flipped;
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelRequested.get();
    }

    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            unpaused.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Set the pause flag if {@code transition} succeeds. The transition and the flag change
     * happen under this control's lock, so a concurrent {@link #resumeIf} cannot interleave.
     *
     * @return the transition's result
     */
    public boolean pauseIf(BooleanSupplier transition) {
        lock.lock();
        try {
            if (!transition.getAsBoolean()) {
                return false;
            }
            paused = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear the pause flag and wake the waiter if {@code transition} succeeds, under the
     * same lock as {@link #pauseIf}.
     */
    public boolean resumeIf(BooleanSupplier transition) {
        lock.lock();
        try {
            if (!transition.getAsBoolean()) {
                return false;
            }
            paused = false;
            unpaused.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    @Override
    public void awaitIfPaused() throws InterruptedException {
        if (!paused) {
            return;
        }
        lock.lockInterruptibly();
        try {
            while (paused && !cancelRequested.get()) {
                unpaused.await();
            }
        } finally {
            lock.unlock();
        }
    }
}
