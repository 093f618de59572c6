package stocksync.engine.limiter;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class DualLimiterTest {

    @Test
    void firstAcquireDoesNotWait() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        DualLimiter limiter = new DualLimiter(2, 5.0, ticker);

        limiter.acquire();

        assertEquals(0, ticker.totalSleptNanos());
        assertEquals(1, limiter.inFlight());
    }

    @Test
    void enforcesMinimumInterval() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        DualLimiter limiter = new DualLimiter(5, 5.0, ticker);

        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        // two waits of 200 ms each
        assertEquals(400_000_000L, ticker.totalSleptNanos(), 1_000L);
    }

    @Test
    void releaseFreesSlotButKeepsInterval() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        DualLimiter limiter = new DualLimiter(1, 1.0, ticker);

        limiter.acquire();
        limiter.release();
        assertEquals(1, limiter.availableSlots());

        ticker.advanceMillis(400);
        limiter.acquire();

        assertEquals(600_000_000L, ticker.totalSleptNanos(), 1_000L);
    }

    @Test
    void blocksWhenAllSlotsAreTaken() throws Exception {
        DualLimiter limiter = new DualLimiter(1, 1000.0);
        limiter.acquire();

        AtomicBoolean acquired = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire();
                acquired.set(true);
                limiter.release();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        waiter.start();

        assertFalse(done.await(200, TimeUnit.MILLISECONDS));
        assertFalse(acquired.get());

        limiter.release();
        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(acquired.get());
    }

    @Test
    void permitReleasesOnClose() throws InterruptedException {
        DualLimiter limiter = new DualLimiter(2, 100.0, new FakeTicker());

        try (DualLimiter.Permit permit = limiter.permit()) {
            assertEquals(1, limiter.inFlight());
        }
        assertEquals(0, limiter.inFlight());
    }
}
