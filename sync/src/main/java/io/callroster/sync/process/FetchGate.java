package io.callroster.sync.process;

/**
 * Single "a roster fetch is outstanding" slot shared by missing-participant
 * backfill, pagination and resync, plus the sticky flag for a resync that had to
 * wait for the slot.
 * <p>
 * Confined to the call queue.
 */
public final class FetchGate {

    private boolean loading;
    private boolean resyncDeferred;

    /** Take the slot; false if a fetch is already outstanding. */
    public boolean tryAcquire() {
        if (loading) {
            return false;
        }
        loading = true;
        return true;
    }

    public void release() {
        loading = false;
    }

    public boolean isLoading() { return loading; }

    public void deferResync() {
        resyncDeferred = true;
    }

    public boolean isResyncDeferred() { return resyncDeferred; }

    /** Clear and return the deferred-resync flag. */
    public boolean takeDeferredResync() {
        boolean r = resyncDeferred;
        resyncDeferred = false;
        return r;
    }
}
