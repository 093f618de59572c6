package stocksync.engine.model;

/**
 * Result of a control command (cancel, pause, resume, delete) sent to a task.
 */
public enum TaskCommandResult {
    /** Command accepted; for cancel of a running task the stop itself is cooperative */
    APPLIED,

    /** Task not found */
    NOT_FOUND,

    /** Task is in a state where the command does not apply (e.g. already terminal) */
    INVALID_STATE;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
