package stocksync.engine.repository;

import stocksync.engine.batch.BatchProgress;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store of live batch progress records keyed by batch id.
 * Records outlive the batch run so that callers can poll them afterwards.
 */
public interface BatchProgressRepository {

    /**
     * Insert or replace the record for {@code progress.batchId()}.
     */
    void save(BatchProgress progress);

    /**
     * Atomically replace an existing record.
     *
     * @return the new record, or empty if no record exists for the id
     */
    Optional<BatchProgress> update(String batchId, UnaryOperator<BatchProgress> update);

    Optional<BatchProgress> findById(String batchId);

    List<BatchProgress> findAll();

    boolean delete(String batchId);
}
