package io.callroster.sync.stream;

import io.callroster.core.Cancellable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fire-and-forget event pipe: no current value, subscribers only see events
 * emitted after they subscribed.
 */
public final class EventStream<T> {
    private static final Logger log = Logger.getLogger(EventStream.class.getName());

    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    public void emit(T event) {
        Objects.requireNonNull(event, "event");
        for (Consumer<? super T> l : listeners) {
            try {
                l.accept(event);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "event listener failed", e);
            }
        }
    }

    public Cancellable subscribe(Consumer<? super T> listener) {
        Consumer<? super T> l = Objects.requireNonNull(listener, "listener");
        // wrap so that removing one subscription never removes an identical lambda registered twice
        Consumer<T> wrapped = l::accept;
        listeners.add(wrapped);
        return () -> listeners.remove(wrapped);
    }
}
