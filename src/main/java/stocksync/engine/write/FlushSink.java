package stocksync.engine.write;

import java.util.List;

/**
 * Durable write of a buffered chunk of results, supplied by the caller.
 */
@FunctionalInterface
public interface FlushSink<T> {

    void flush(List<T> items) throws Exception;
}
