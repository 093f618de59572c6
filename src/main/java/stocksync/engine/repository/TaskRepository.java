package stocksync.engine.repository;

import stocksync.engine.queue.Task;

import java.util.List;
import java.util.Optional;

/**
 * Registry of live task records.
 * Implementations keep records in process memory; they are lost on restart.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * All known tasks, in no particular order.
     */
    List<Task> findAll();

    /**
     * Remove a task record.
     *
     * @param taskId the task ID
     * @return true if a record was removed
     */
    boolean delete(String taskId);

    int count();
}
