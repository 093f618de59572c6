package stocksync.engine.sync;

import java.util.List;

/**
 * Outcome of fetching one unit of work. The payload is opaque to the engine.
 */
public record FetchResult<T>(boolean success, int count, List<T> data, String message, String syncMode) {

    public FetchResult {
        data = data == null ? List.of() : List.copyOf(data);
        message = message == null ? "" : message;
    }

    public static <T> FetchResult<T> success(List<T> data, String syncMode) {
        List<T> rows = data == null ? List.of() : data;
        return new FetchResult<>(true, rows.size(), rows, rows.isEmpty() ? "No new data" : "OK", syncMode);
    }

    public static <T> FetchResult<T> failure(String message) {
        return new FetchResult<>(false, 0, List.of(), message, null);
    }
}
