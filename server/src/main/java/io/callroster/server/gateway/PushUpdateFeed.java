package io.callroster.server.gateway;

import io.callroster.core.Cancellable;
import io.callroster.sync.net.CallUpdateFeed;
import io.callroster.sync.net.ScopedUpdate;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CallUpdateFeed} fed by the gateway pushing to our HTTP endpoint.
 * Each published batch goes to every subscriber; contexts filter by call id.
 */
public final class PushUpdateFeed implements CallUpdateFeed {
    private static final Logger log = Logger.getLogger(PushUpdateFeed.class.getName());

    private final List<Consumer<List<ScopedUpdate>>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Cancellable subscribe(Consumer<List<ScopedUpdate>> listener) {
        Objects.requireNonNull(listener, "listener");
        Consumer<List<ScopedUpdate>> wrapped = listener::accept;
        listeners.add(wrapped);
        return () -> listeners.remove(wrapped);
    }

    public void publish(List<ScopedUpdate> batch) {
        List<ScopedUpdate> copy = List.copyOf(batch);
        for (Consumer<List<ScopedUpdate>> l : listeners) {
            try {
                l.accept(copy);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "update feed listener failed", e);
            }
        }
    }

    public int subscriberCount() { return listeners.size(); }
}
