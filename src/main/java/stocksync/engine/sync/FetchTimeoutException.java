package stocksync.engine.sync;

import java.time.Duration;

/**
 * A blocking provider call did not return within its time budget.
 */
public class FetchTimeoutException extends RuntimeException {

    private final Duration timeout;

    public FetchTimeoutException(Duration timeout) {
        super("Request timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
