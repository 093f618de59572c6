package stocksync.engine.write;

import stocksync.engine.limiter.FakeTicker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BufferedFlusherTest {

    @Test
    void writesFullChunksAndDrainsRemainder() {
        List<List<Integer>> written = new ArrayList<>();
        BufferedFlusher<Integer> flusher = new BufferedFlusher<>(
                new BatchWriter<>(2, Duration.ofHours(1), new FakeTicker()),
                items -> written.add(List.copyOf(items)));

        assertFalse(flusher.offer(1));
        assertTrue(flusher.offer(2));
        assertFalse(flusher.offer(3));
        assertEquals(1, flusher.pending());

        flusher.drain();

        assertEquals(List.of(List.of(1, 2), List.of(3)), written);
        assertEquals(3, flusher.flushedItems());
        assertEquals(2, flusher.flushCount());
        assertEquals(0, flusher.pending());
    }

    @Test
    void drainOnEmptyBufferDoesNothing() {
        List<List<Integer>> written = new ArrayList<>();
        BufferedFlusher<Integer> flusher = new BufferedFlusher<>(
                new BatchWriter<>(2, Duration.ofHours(1), new FakeTicker()),
                items -> written.add(List.copyOf(items)));

        flusher.drain();

        assertTrue(written.isEmpty());
        assertEquals(0, flusher.flushCount());
    }

    @Test
    void sinkFailureIsCountedNotThrown() {
        BufferedFlusher<Integer> flusher = new BufferedFlusher<>(
                new BatchWriter<>(1, Duration.ofHours(1), new FakeTicker()),
                items -> {
                    throw new IllegalStateException("database down");
                });

        assertDoesNotThrow(() -> flusher.offer(1));

        assertEquals(1, flusher.failedFlushes());
        assertEquals(1, flusher.droppedItems());
        assertEquals(0, flusher.flushedItems());
    }
}
