package stocksync.engine.store;

import stocksync.engine.queue.Task;
import stocksync.engine.repository.TaskRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task registry backed by a concurrent map.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        Objects.requireNonNull(task, "task is required");
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<Task> findById(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findAll() {
        return new ArrayList<>(tasks.values());
    }

    @Override
    public boolean delete(String taskId) {
        return taskId != null && tasks.remove(taskId) != null;
    }

    @Override
    public int count() {
        return tasks.size();
    }
}
