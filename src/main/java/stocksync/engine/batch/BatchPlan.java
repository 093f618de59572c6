package stocksync.engine.batch;

import java.util.List;
import java.util.Optional;

/**
 * Result of planning: the batches, the prefix their ids share, and how many targets
 * were left out because their data was already current.
 */
public record BatchPlan(String prefix, List<Batch> batches, int skippedFresh, int totalTargets) {

    public BatchPlan {
        batches = List.copyOf(batches);
    }

    public boolean isEmpty() {
        return batches.isEmpty();
    }

    public int plannedTargets() {
        return batches.stream().mapToInt(Batch::itemCount).sum();
    }

    /** Look up a batch by its 1-based index. */
    public Optional<Batch> batch(int index) {
        if (index < 1 || index > batches.size()) {
            return Optional.empty();
        }
        return Optional.of(batches.get(index - 1));
    }
}
