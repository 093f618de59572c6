package stocksync.engine.config;

import stocksync.engine.batch.BatchSyncManager;
import stocksync.engine.limiter.RateLimiter;
import stocksync.engine.queue.TaskHandlerRegistry;
import stocksync.engine.queue.TaskQueue;
import stocksync.engine.repository.BatchProgressRepository;
import stocksync.engine.repository.TaskRepository;
import stocksync.engine.store.InMemoryBatchProgressRepository;
import stocksync.engine.store.InMemoryTaskRepository;
import stocksync.engine.sync.BlockingCallExecutor;
import stocksync.engine.sync.ConcurrentSyncService;
import stocksync.engine.sync.FetchedRows;
import stocksync.engine.sync.FreshnessPolicy;
import stocksync.engine.sync.RetryingFetcher;
import stocksync.engine.sync.SequentialSyncJob;
import stocksync.engine.sync.SyncTarget;
import stocksync.engine.sync.TargetFilter;
import stocksync.engine.sync.TargetSyncer;
import stocksync.engine.sync.TradingCalendar;
import stocksync.engine.sync.UnitOfWorkFetcher;
import stocksync.engine.write.BatchWriter;
import stocksync.engine.write.BufferedFlusher;
import stocksync.engine.write.FlushSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Manual dependency injection container.
 * Creates and wires the engine around a caller-supplied data provider and row sink.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SyncConfig.fromEnv(), fetcher, sink, targets, probe);
 * String taskId = deps.taskQueue().submit(JobDescriptor.of(SequentialSyncJob.KIND));
 * // ... poll deps.taskQueue().getTask(taskId) ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SyncConfig config;
    private final TaskRepository taskRepository;
    private final BatchProgressRepository batchProgressRepository;
    private final TaskHandlerRegistry registry;
    private final TaskQueue taskQueue;
    private final RateLimiter rateLimiter;
    private final BlockingCallExecutor blockingCallExecutor;
    private final TradingCalendar calendar;
    private final FreshnessPolicy freshnessPolicy;
    private final TargetSyncer<?> targetSyncer;
    private final BatchSyncManager batchSyncManager;
    private final ConcurrentSyncService<?> concurrentSyncService;

    private <T> Dependencies(SyncConfig config, Clock clock, UnitOfWorkFetcher<T> fetcher,
            FlushSink<FetchedRows<T>> sink, Supplier<List<SyncTarget>> targetSource,
            Supplier<Optional<LocalDate>> tradeDateProbe) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Stores
        this.taskRepository = new InMemoryTaskRepository();
        this.batchProgressRepository = new InMemoryBatchProgressRepository();

        // One request budget for queued and direct runs
        this.rateLimiter = new RateLimiter(config.queueRatePerSecond(), config.queueBurst());

        // Unit of work
        this.blockingCallExecutor = new BlockingCallExecutor(config.blockingPoolSize());
        RetryingFetcher<T> retrying = new RetryingFetcher<>(fetcher, blockingCallExecutor,
                config.requestTimeout(), config.maxRetries(), config.retryBackoffStep());
        BufferedFlusher<FetchedRows<T>> flusher = new BufferedFlusher<>(
                new BatchWriter<>(config.writerBatchSize(), config.writerFlushInterval()), sink);
        TargetSyncer<T> syncer = new TargetSyncer<>(retrying, flusher);
        this.targetSyncer = syncer;

        // Freshness
        this.calendar = new TradingCalendar(clock, tradeDateProbe);
        this.freshnessPolicy = new FreshnessPolicy(calendar, config.recencyWindowDays());

        // Services
        TargetFilter filter = TargetFilter.tradable();
        this.batchSyncManager = new BatchSyncManager(config, syncer, freshnessPolicy, filter,
                batchProgressRepository, rateLimiter, clock);
        ConcurrentSyncService<T> concurrent = new ConcurrentSyncService<>(retrying, config, filter);
        this.concurrentSyncService = concurrent;

        // Job kinds
        this.registry = new TaskHandlerRegistry()
                .register(SequentialSyncJob.KIND,
                        new SequentialSyncJob<>(targetSource, syncer, filter, config.failureSampleSize()))
                .register(ConcurrentSyncService.KIND, concurrent.asHandler(targetSource, sink))
                .register(BatchSyncManager.KIND, batchSyncManager.asHandler(targetSource));

        this.taskQueue = new TaskQueue(config, rateLimiter, taskRepository, registry);

        log.info("Dependencies initialized, job kinds: {}", registry.kinds());
    }

    /**
     * Create dependencies with the given config.
     *
     * @param fetcher        per-target data provider call
     * @param sink           receives fetched rows in chunks
     * @param targetSource   the current target universe with freshness markers
     * @param tradeDateProbe latest trading date from the provider, empty when unknown
     */
    public static <T> Dependencies create(SyncConfig config, UnitOfWorkFetcher<T> fetcher,
            FlushSink<FetchedRows<T>> sink, Supplier<List<SyncTarget>> targetSource,
            Supplier<Optional<LocalDate>> tradeDateProbe) {
        return new Dependencies(config, Clock.systemDefaultZone(), fetcher, sink, targetSource, tradeDateProbe);
    }

    public static <T> Dependencies create(SyncConfig config, Clock clock, UnitOfWorkFetcher<T> fetcher,
            FlushSink<FetchedRows<T>> sink, Supplier<List<SyncTarget>> targetSource,
            Supplier<Optional<LocalDate>> tradeDateProbe) {
        return new Dependencies(config, clock, fetcher, sink, targetSource, tradeDateProbe);
    }

    // Getters
    public SyncConfig config() {
        return config;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public BatchProgressRepository batchProgressRepository() {
        return batchProgressRepository;
    }

    public TaskHandlerRegistry registry() {
        return registry;
    }

    public TaskQueue taskQueue() {
        return taskQueue;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public TradingCalendar calendar() {
        return calendar;
    }

    public FreshnessPolicy freshnessPolicy() {
        return freshnessPolicy;
    }

    public TargetSyncer<?> targetSyncer() {
        return targetSyncer;
    }

    public BatchSyncManager batchSyncManager() {
        return batchSyncManager;
    }

    public ConcurrentSyncService<?> concurrentSyncService() {
        return concurrentSyncService;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop workers first
        try {
            taskQueue.stop();
        } catch (Exception e) {
            log.warn("Error stopping task queue: {}", e.getMessage());
        }

        try {
            targetSyncer.drain();
        } catch (Exception e) {
            log.warn("Error draining write buffer: {}", e.getMessage());
        }

        blockingCallExecutor.close();

        log.info("Dependencies closed");
    }
}
