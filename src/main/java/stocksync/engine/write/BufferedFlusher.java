package stocksync.engine.write;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pairs a {@link BatchWriter} with a caller's {@link FlushSink}.
 *
 * <p>Sink failures stop here: they are logged and counted, never rethrown to the
 * producer, and the failed chunk is not retried.
 */
public class BufferedFlusher<T> {

    private static final Logger log = LoggerFactory.getLogger(BufferedFlusher.class);

    private final BatchWriter<T> writer;
    private final FlushSink<T> sink;

    private final AtomicLong flushedItems = new AtomicLong();
    private final AtomicInteger flushCount = new AtomicInteger();
    private final AtomicInteger failedFlushes = new AtomicInteger();
    private final AtomicLong droppedItems = new AtomicLong();

    public BufferedFlusher(BatchWriter<T> writer, FlushSink<T> sink) {
        this.writer = writer;
        this.sink = sink;
    }

    /**
     * Buffer an item and write the buffered chunk if a flush is due.
     *
     * @return true if this call triggered a write attempt
     */
    public boolean offer(T item) {
        if (!writer.add(item)) {
            return false;
        }
        write(writer.getBatch());
        return true;
    }

    /**
     * Write whatever is still buffered.
     */
    public void drain() {
        List<T> rest = writer.getBatch();
        if (!rest.isEmpty()) {
            write(rest);
        }
    }

    private void write(List<T> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            sink.flush(batch);
            flushedItems.addAndGet(batch.size());
            flushCount.incrementAndGet();
            log.debug("Flushed {} buffered item(s)", batch.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failedFlushes.incrementAndGet();
            droppedItems.addAndGet(batch.size());
            log.warn("Flush of {} item(s) interrupted", batch.size());
        } catch (Exception e) {
            failedFlushes.incrementAndGet();
            droppedItems.addAndGet(batch.size());
            log.error("Flush of {} item(s) failed", batch.size(), e);
        }
    }

    public long flushedItems() {
        return flushedItems.get();
    }

    public int flushCount() {
        return flushCount.get();
    }

    public int failedFlushes() {
        return failedFlushes.get();
    }

    public long droppedItems() {
        return droppedItems.get();
    }

    public int pending() {
        return writer.size();
    }
}
