// file: src/main/java/io/callroster/sync/stream/ValueStream.java
package io.callroster.sync.stream;

import io.callroster.core.Cancellable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observable current value.
 * <p>
 * Semantics:
 *  - A new subscriber immediately receives the current value.
 *  - {@link #set} only notifies when the value actually changed (equals-based).
 *  - Listener exceptions are logged; they never reach the publisher.
 */
public final class ValueStream<T> {
    private static final Logger log = Logger.getLogger(ValueStream.class.getName());

    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private volatile T value;

    public ValueStream(T initial) {
        this.value = Objects.requireNonNull(initial, "initial");
    }

    public T get() { return value; }

    public void set(T next) {
        Objects.requireNonNull(next, "next");
        if (next.equals(value)) {
            return;
        }
        value = next;
        for (Subscription s : subscribers) {
            s.deliver(next);
        }
    }

    public Cancellable subscribe(Consumer<? super T> listener) {
        var s = new Subscription(Objects.requireNonNull(listener, "listener"));
        subscribers.add(s);
        s.deliver(value);
        return () -> subscribers.remove(s);
    }

    public int subscriberCount() { return subscribers.size(); }

    private final class Subscription {
        private final Consumer<? super T> listener;

        Subscription(Consumer<? super T> listener) {
            this.listener = listener;
        }

        void deliver(T v) {
            try {
                listener.accept(v);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "value listener failed", e);
            }
        }
    }
}
