package io.callroster.sync.process;

import io.callroster.core.OverlayState;
import io.callroster.core.ParticipantsState;

import java.util.Objects;

/** Authoritative state plus pending local overlay: the unit that is swapped atomically. */
public record InternalState(ParticipantsState state, OverlayState overlay) {
    public InternalState {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(overlay, "overlay");
    }
}
