package stocksync.engine.queue;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskHandlerRegistryTest {

    @Test
    void resolvesRegisteredKinds() {
        TaskHandler handler = (task, limiter) -> { };
        TaskHandlerRegistry registry = new TaskHandlerRegistry().register("kline_sync", handler);

        assertSame(handler, registry.resolve("kline_sync").orElseThrow());
        assertTrue(registry.supports("kline_sync"));
        assertTrue(registry.resolve("batch_sync").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
        assertEquals(Set.of("kline_sync"), registry.kinds());
    }

    @Test
    void rejectsDuplicateAndBlankKinds() {
        TaskHandlerRegistry registry = new TaskHandlerRegistry().register("a", (task, limiter) -> { });

        assertThrows(IllegalStateException.class, () -> registry.register("a", (task, limiter) -> { }));
        assertThrows(IllegalArgumentException.class, () -> registry.register("", (task, limiter) -> { }));
    }
}
