package io.callroster.sync.net;

import io.callroster.core.Cancellable;

import java.util.List;
import java.util.function.Consumer;

/**
 * Push side of the transport: batches of updates for any call this client
 * follows. Subscribers filter by call id.
 */
public interface CallUpdateFeed {

    Cancellable subscribe(Consumer<List<ScopedUpdate>> listener);
}
