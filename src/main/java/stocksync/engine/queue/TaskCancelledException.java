package stocksync.engine.queue;

/**
 * Thrown by an executor that stops early because its task was cancelled.
 * The worker records the task as CANCELLED, not FAILED.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
