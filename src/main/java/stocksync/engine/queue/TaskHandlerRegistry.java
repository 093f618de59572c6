package stocksync.engine.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a job kind to the handler that executes it.
 */
public class TaskHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskHandlerRegistry.class);

    private final ConcurrentHashMap<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register a handler for a job kind.
     *
     * @throws IllegalStateException if the kind is already registered
     */
    public TaskHandlerRegistry register(String kind, TaskHandler handler) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
        Objects.requireNonNull(handler, "handler is required");

        TaskHandler previous = handlers.putIfAbsent(kind, handler);
        if (previous != null) {
            throw new IllegalStateException("Handler already registered for kind: " + kind);
        }
        log.debug("Registered handler for job kind '{}'", kind);
        return this;
    }

    public Optional<TaskHandler> resolve(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(kind));
    }

    public boolean supports(String kind) {
        return kind != null && handlers.containsKey(kind);
    }

    public Set<String> kinds() {
        return new TreeSet<>(handlers.keySet());
    }
}
