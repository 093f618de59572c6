package stocksync.engine.store;

import stocksync.engine.batch.BatchProgress;
import stocksync.engine.repository.BatchProgressRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Batch progress store backed by a concurrent map.
 */
public class InMemoryBatchProgressRepository implements BatchProgressRepository {

    private final ConcurrentHashMap<String, BatchProgress> records = new ConcurrentHashMap<>();

    @Override
    public void save(BatchProgress progress) {
        Objects.requireNonNull(progress, "progress is required");
        records.put(progress.batchId(), progress);
    }

    @Override
    public Optional<BatchProgress> update(String batchId, UnaryOperator<BatchProgress> update) {
        if (batchId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.computeIfPresent(batchId, (id, current) -> update.apply(current)));
    }

    @Override
    public Optional<BatchProgress> findById(String batchId) {
        if (batchId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(batchId));
    }

    @Override
    public List<BatchProgress> findAll() {
        List<BatchProgress> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(BatchProgress::batchId));
        return all;
    }

    @Override
    public boolean delete(String batchId) {
        return batchId != null && records.remove(batchId) != null;
    }
}
