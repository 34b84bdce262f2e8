package io.callroster.sync;

/**
 * Local bookkeeping that outlives a single context of the same call.
 * <p>
 * Passing the ServiceState of a previous context into a new one keeps activity
 * ranks monotonic when the context is rebuilt (e.g. after rejoining).
 *
 * @param nextActivityRank the rank the next newly active speaker will get
 */
public record ServiceState(int nextActivityRank) {

    public ServiceState {
        if (nextActivityRank < 0) throw new IllegalArgumentException("nextActivityRank must be >= 0");
    }

    public static ServiceState initial() { return new ServiceState(0); }
}
