package io.callroster.core;

/**
 * Handle to something that can be stopped: an in-flight request, a scheduled
 * task or a stream subscription. Cancelling twice is a no-op.
 */
@FunctionalInterface
public interface Cancellable {

    void cancel();

    static Cancellable noop() {
        return () -> { };
    }
}
