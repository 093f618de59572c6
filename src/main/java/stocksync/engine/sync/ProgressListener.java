package stocksync.engine.sync;

/**
 * Progress callback consumed by the UI layer.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message) -> {
    };

    void onProgress(double percent, String message);
}
