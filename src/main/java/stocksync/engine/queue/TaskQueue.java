package stocksync.engine.queue;

import stocksync.engine.config.SyncConfig;
import stocksync.engine.limiter.RateLimiter;
import stocksync.engine.model.JobDescriptor;
import stocksync.engine.model.TaskCommandResult;
import stocksync.engine.model.TaskInfo;
import stocksync.engine.model.TaskListing;
import stocksync.engine.model.TaskStatus;
import stocksync.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory task queue drained by a fixed pool of workers.
 *
 * <p>Lifecycle: PENDING → RUNNING → SUCCESS | FAILED | CANCELLED, RUNNING ⇄ PAUSED and
 * PENDING → CANCELLED. A task is executed by at most one worker. All tasks on one queue
 * share a single {@link RateLimiter}, which is where outbound request pacing happens.
 *
 * <p>Pause and cancel are cooperative: the queue flips flags on the task's
 * {@link TaskControl} and the handler honours them at its next safe point. Workers are
 * started lazily by the first submit.
 */
public class TaskQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private static final long POLL_TIMEOUT_MS = 1000;
    private static final Set<TaskStatus> IN_FLIGHT = EnumSet.of(TaskStatus.RUNNING, TaskStatus.PAUSED);

    private final String name;
    private final int workerCount;
    private final RateLimiter rateLimiter;
    private final TaskRepository repository;
    private final TaskHandlerRegistry registry;
    private final Duration shutdownGrace;
    private final LinkedBlockingQueue<Entry> queue = new LinkedBlockingQueue<>();

    private ExecutorService workers;
    private volatile boolean running = false;

    public TaskQueue(SyncConfig config, TaskRepository repository, TaskHandlerRegistry registry) {
        this(config, new RateLimiter(config.queueRatePerSecond(), config.queueBurst()), repository, registry);
    }

    public TaskQueue(SyncConfig config, RateLimiter rateLimiter, TaskRepository repository,
            TaskHandlerRegistry registry) {
        this("task-queue", config.workerCount(), rateLimiter, repository, registry, Duration.ofSeconds(5));
    }

    public TaskQueue(String name, int workerCount, RateLimiter rateLimiter,
            TaskRepository repository, TaskHandlerRegistry registry, Duration shutdownGrace) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.name = name;
        this.workerCount = workerCount;
        this.rateLimiter = rateLimiter;
        this.repository = repository;
        this.registry = registry;
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Submit a task with an explicit handler.
     *
     * @return the new task id; the task is PENDING until a worker picks it up
     * @throws IllegalArgumentException if type is blank or handler is null
     */
    public String submit(String type, Map<String, Object> params, TaskHandler handler) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("task type is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }

        String taskId = UUID.randomUUID().toString();
        Task task = new Task(taskId, type, params, "Queued, waiting for a worker", Instant.now());

        repository.save(task);
        queue.offer(new Entry(taskId, handler));

        if (!running) {
            start();
        }

        log.info("Task submitted: {} - {}", type, taskId);
        return taskId;
    }

    /**
     * Submit a job whose handler is looked up by kind.
     *
     * @throws IllegalArgumentException if no handler is registered for the kind
     */
    public String submit(JobDescriptor job) {
        TaskHandler handler = registry.resolve(job.kind())
                .orElseThrow(() -> new IllegalArgumentException("Unknown job kind: " + job.kind()));
        return submit(job.kind(), job.params(), handler);
    }

    /**
     * Start the worker pool. No-op if already running.
     */
    public synchronized void start() {
        if (running) {
            return;
        }

        AtomicInteger threadIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, name + "-worker-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        running = true;

        for (int i = 0; i < workerCount; i++) {
            int workerId = i;
            workers.submit(() -> workerLoop(workerId));
        }

        log.info("Task queue '{}' started with {} worker(s), {}", name, workerCount, rateLimiter);
    }

    /**
     * Stop the workers. Running handlers get the grace period to return, then they are
     * interrupted and their tasks end as CANCELLED. Queued tasks stay PENDING.
     */
    public void stop() {
        ExecutorService pool;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            pool = workers;
            workers = null;
        }

        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
                log.warn("Task queue '{}' forcefully stopped", name);
            } else {
                log.info("Task queue '{}' stopped gracefully", name);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void workerLoop(int workerId) {
        log.debug("Worker #{} of '{}' started", workerId, name);

        while (running && !Thread.currentThread().isInterrupted()) {
            Entry entry;
            try {
                entry = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (entry == null) {
                continue;
            }

            try {
                runTask(entry);
            } catch (Throwable e) {
                log.error("Worker #{} error on task {}", workerId, entry.taskId(), e);
            }
        }

        log.debug("Worker #{} of '{}' exited", workerId, name);
    }

    private void runTask(Entry entry) {
        Task task = repository.findById(entry.taskId()).orElse(null);
        if (task == null) {
            log.debug("Task {} was deleted before it started", entry.taskId());
            return;
        }

        if (task.control().isCancellationRequested()) {
            task.transition(EnumSet.of(TaskStatus.PENDING), s -> s.toBuilder()
                    .status(TaskStatus.CANCELLED)
                    .message("Cancelled before start")
                    .completedAt(Instant.now())
                    .build());
            return;
        }

        boolean started = task.transition(EnumSet.of(TaskStatus.PENDING), s -> s.toBuilder()
                .status(TaskStatus.RUNNING)
                .startedAt(Instant.now())
                .progress(0.0)
                .message("Running...")
                .build());
        if (!started) {
            log.debug("Task {} is {}, skipping", task.id(), task.status());
            return;
        }

        try {
            entry.handler().execute(task, rateLimiter);

            if (task.control().isCancellationRequested()) {
                finish(task, TaskStatus.CANCELLED, "Task cancelled", null);
                log.info("Task cancelled: {} - {}", task.type(), task.id());
            } else {
                finish(task, TaskStatus.SUCCESS, "Task completed successfully", null);
                log.info("Task succeeded: {} - {}", task.type(), task.id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(task, TaskStatus.CANCELLED, "Task interrupted by queue shutdown", null);
            log.info("Task interrupted: {} - {}", task.type(), task.id());
        } catch (TaskCancelledException e) {
            finish(task, TaskStatus.CANCELLED, "Task cancelled", null);
            log.info("Task cancelled: {} - {}", task.type(), task.id());
        } catch (Exception e) {
            String error = describe(e);
            finish(task, TaskStatus.FAILED, "Task failed: " + error, error);
            log.error("Task failed: {} - {}: {}", task.type(), task.id(), error, e);
        } catch (Error e) {
            // the worker survives a handler Error; the task must not stay RUNNING
            String error = e.getClass().getSimpleName() + ": " + describe(e);
            finish(task, TaskStatus.FAILED, "Task failed: " + error, error);
            log.error("Task failed with error: {} - {}", task.type(), task.id(), e);
        }
    }

    private void finish(Task task, TaskStatus status, String message, String error) {
        task.transition(IN_FLIGHT, s -> {
            TaskInfo.Builder b = s.toBuilder()
                    .status(status)
                    .message(message)
                    .error(error)
                    .completedAt(Instant.now());
            if (status == TaskStatus.SUCCESS) {
                b.progress(100.0);
            }
            return b.build();
        });
    }

    /**
     * Cancel a task. A PENDING task is cancelled at once and never runs. For a RUNNING or
     * PAUSED task only the cancel flag is set; the handler stops at its next safe point.
     */
    public TaskCommandResult cancel(String taskId) {
        Task task = repository.findById(taskId).orElse(null);
        if (task == null) {
            return TaskCommandResult.NOT_FOUND;
        }

        boolean cancelledPending = task.transition(EnumSet.of(TaskStatus.PENDING), s -> s.toBuilder()
                .status(TaskStatus.CANCELLED)
                .message("Task cancelled before start")
                .completedAt(Instant.now())
                .build());
        if (cancelledPending) {
            task.control().requestCancel();
            log.info("Task cancelled: {}", taskId);
            return TaskCommandResult.APPLIED;
        }

        boolean inFlight = task.transition(IN_FLIGHT, s -> s.toBuilder()
                .message("Cancelling task...")
                .build());
        if (!inFlight) {
            return TaskCommandResult.INVALID_STATE;
        }

        task.control().requestCancel();
        log.info("Cancellation requested for task: {}", taskId);
        return TaskCommandResult.APPLIED;
    }

    /**
     * Pause a RUNNING task at the handler's next safe point.
     */
    public TaskCommandResult pause(String taskId) {
        Task task = repository.findById(taskId).orElse(null);
        if (task == null) {
            return TaskCommandResult.NOT_FOUND;
        }

        boolean paused = task.control().pauseIf(() -> task.transition(EnumSet.of(TaskStatus.RUNNING),
                s -> s.toBuilder()
                        .status(TaskStatus.PAUSED)
                        .message("Task paused")
                        .build()));
        if (!paused) {
            return TaskCommandResult.INVALID_STATE;
        }

        log.info("Task paused: {}", taskId);
        return TaskCommandResult.APPLIED;
    }

    /**
     * Resume a PAUSED task.
     */
    public TaskCommandResult resume(String taskId) {
        Task task = repository.findById(taskId).orElse(null);
        if (task == null) {
            return TaskCommandResult.NOT_FOUND;
        }

        boolean resumed = task.control().resumeIf(() -> task.transition(EnumSet.of(TaskStatus.PAUSED),
                s -> s.toBuilder()
                        .status(TaskStatus.RUNNING)
                        .message("Task resumed")
                        .build()));
        if (!resumed) {
            return TaskCommandResult.INVALID_STATE;
        }

        log.info("Task resumed: {}", taskId);
        return TaskCommandResult.APPLIED;
    }

    /**
     * Remove a task record. In-flight tasks cannot be deleted; a deleted PENDING task is
     * skipped by the workers.
     */
    public TaskCommandResult deleteTask(String taskId) {
        Task task = repository.findById(taskId).orElse(null);
        if (task == null) {
            return TaskCommandResult.NOT_FOUND;
        }
        if (IN_FLIGHT.contains(task.status())) {
            return TaskCommandResult.INVALID_STATE;
        }

        task.control().requestCancel();
        repository.delete(taskId);
        log.info("Task record deleted: {}", taskId);
        return TaskCommandResult.APPLIED;
    }

    public Optional<TaskInfo> getTask(String taskId) {
        return repository.findById(taskId).map(Task::info);
    }

    public List<TaskInfo> getAllTasks() {
        return repository.findAll().stream()
                .map(Task::info)
                .toList();
    }

    /**
     * Tasks newest first, optionally filtered by status.
     *
     * @param status filter, or null for all
     * @param limit  maximum tasks in the page
     */
    public TaskListing listTasks(TaskStatus status, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }

        List<TaskInfo> matching = repository.findAll().stream()
                .map(Task::info)
                .filter(t -> status == null || t.status() == status)
                .sorted(Comparator.comparing(TaskInfo::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();

        int runningCount = (int) matching.stream().filter(t -> t.status() == TaskStatus.RUNNING).count();
        int pendingCount = (int) matching.stream().filter(t -> t.status() == TaskStatus.PENDING).count();

        return new TaskListing(
                matching.subList(0, Math.min(limit, matching.size())),
                matching.size(),
                runningCount,
                pendingCount);
    }

    /**
     * Whether a task of this type is queued or in flight. Advisory only: nothing stops
     * another caller from submitting between this check and a submit.
     */
    public boolean hasRunningTaskOfType(String type) {
        for (Task task : repository.findAll()) {
            if (task.type().equals(type) && task.status().isActive()) {
                return true;
            }
        }
        return false;
    }

    public int countByStatus(TaskStatus status) {
        int count = 0;
        for (Task task : repository.findAll()) {
            if (task.status() == status) {
                count++;
            }
        }
        return count;
    }

    public int queuedEntries() {
        return queue.size();
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public String name() {
        return name;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }

    private record Entry(String taskId, TaskHandler handler) {
    }
}
