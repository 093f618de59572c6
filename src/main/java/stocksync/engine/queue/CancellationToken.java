package stocksync.engine.queue;

/**
 * Cooperative stop/pause signal handed to every unit-of-work call.
 *
 * <p>Executors poll it at loop boundaries. Cancellation therefore takes effect at the
 * next poll point, at most one unit of work after it was requested.
 */
public interface CancellationToken {

    /** Token that is never cancelled or paused. */
    CancellationToken NONE = new CancellationToken() {
        @Override
        public boolean isCancellationRequested() {
            return false;
        }

        @Override
        public boolean isPaused() {
            return false;
        }

        @Override
        public void awaitIfPaused() {
        }
    };

    boolean isCancellationRequested();

    boolean isPaused();

    /**
     * Block while paused. Returns immediately when not paused or once cancellation is
     * requested.
     */
    void awaitIfPaused() throws InterruptedException;

    /**
     * Safe point: wait out a pause, then report whether work may continue.
     *
     * @return false if cancellation was requested
     */
    default boolean checkpoint() throws InterruptedException {
        awaitIfPaused();
        return !isCancellationRequested();
    }

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new TaskCancelledException("Cancellation requested");
        }
    }
}
