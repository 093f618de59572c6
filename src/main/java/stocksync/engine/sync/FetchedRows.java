package stocksync.engine.sync;

import java.util.List;

/**
 * Rows fetched for one target, as buffered for a bulk write.
 */
public record FetchedRows<T>(String tsCode, List<T> rows) {

    public FetchedRows {
        rows = List.copyOf(rows);
    }
}
