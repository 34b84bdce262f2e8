// file: src/main/java/io/callroster/sync/process/RosterStore.java
package io.callroster.sync.process;

import io.callroster.core.OverlayState;
import io.callroster.core.ParticipantsState;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Holder of the one mutable {@link InternalState} of a call.
 * <p>
 * Confined to the call queue: no locking, no volatile. Every change replaces
 * the whole InternalState and, if it differs from the previous one, notifies
 * the change listener (which publishes the effective view).
 */
public final class RosterStore {

    private InternalState current;
    private final Consumer<InternalState> onChange;

    public RosterStore(InternalState initial, Consumer<InternalState> onChange) {
        this.current = Objects.requireNonNull(initial, "initial");
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    public InternalState get() { return current; }

    public ParticipantsState state() { return current.state(); }

    public OverlayState overlay() { return current.overlay(); }

    public void set(InternalState next) {
        Objects.requireNonNull(next, "next");
        if (next.equals(current)) {
            return;
        }
        current = next;
        onChange.accept(next);
    }

    public void updateState(UnaryOperator<ParticipantsState> fn) {
        set(new InternalState(fn.apply(current.state()), current.overlay()));
    }

    public void updateOverlay(UnaryOperator<OverlayState> fn) {
        set(new InternalState(current.state(), fn.apply(current.overlay())));
    }
}
