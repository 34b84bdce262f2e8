package io.callroster.sync;

import io.callroster.core.PeerId;

import java.util.Objects;

/** A participant joined or left the call, as observed through applied deltas. */
public record MemberEvent(PeerId peerId, boolean joined) {
    public MemberEvent {
        Objects.requireNonNull(peerId, "peerId");
    }
}
