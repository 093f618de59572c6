package stocksync.engine.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Selects the targets worth syncing.
 */
public final class TargetFilter implements Predicate<SyncTarget> {

    private static final List<String> EXCLUDED_NAME_MARKERS = List.of("ST", "*ST", "退");

    private final boolean skipFlagged;

    private TargetFilter(boolean skipFlagged) {
        this.skipFlagged = skipFlagged;
    }

    /** Active targets, minus special-treatment and delisting names. */
    public static TargetFilter tradable() {
        return new TargetFilter(true);
    }

    /** Active targets only. */
    public static TargetFilter activeOnly() {
        return new TargetFilter(false);
    }

    @Override
    public boolean test(SyncTarget target) {
        if (!target.active()) {
            return false;
        }
        if (!skipFlagged) {
            return true;
        }
        for (String marker : EXCLUDED_NAME_MARKERS) {
            if (target.name().contains(marker)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Matching targets in input order, first occurrence of each code kept.
     */
    public List<SyncTarget> apply(Collection<SyncTarget> targets) {
        Set<String> seen = new LinkedHashSet<>();
        List<SyncTarget> eligible = new ArrayList<>(targets.size());
        for (SyncTarget target : targets) {
            if (test(target) && seen.add(target.tsCode())) {
                eligible.add(target);
            }
        }
        return eligible;
    }
}
