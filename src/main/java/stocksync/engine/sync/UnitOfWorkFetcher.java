package stocksync.engine.sync;

/**
 * Caller-supplied fetch of one target's data from the upstream provider.
 */
@FunctionalInterface
public interface UnitOfWorkFetcher<T> {

    /**
     * @param target        the target to fetch
     * @param forceFullSync fetch full history instead of the incremental window
     * @return success flag, row count and payload; exceptions count as failures too
     */
    FetchResult<T> fetch(SyncTarget target, boolean forceFullSync) throws Exception;
}
