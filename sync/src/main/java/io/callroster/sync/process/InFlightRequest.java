package io.callroster.sync.process;

import io.callroster.core.Cancellable;

import java.util.concurrent.CompletableFuture;

/**
 * Cancellation handle for one outstanding network request.
 * <p>
 * Once cancelled, the completion handler must ignore the result: the request
 * has been superseded or the call has been torn down.
 */
public final class InFlightRequest implements Cancellable {

    private volatile boolean cancelled;
    private volatile CompletableFuture<?> future;

    public void bind(CompletableFuture<?> f) {
        this.future = f;
        if (cancelled) {
            f.cancel(false);
        }
    }

    @Override
    public void cancel() {
        cancelled = true;
        CompletableFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }

    public boolean isCancelled() { return cancelled; }
}
