// file: src/main/java/io/callroster/core/OverlayState.java
package io.callroster.core;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Local mute/volume changes that were requested but not yet confirmed by the server.
 * <p>
 * An entry exists only while its request is in flight. It disappears when
 * the server confirms (a delta names the peer in removePendingMuteStates), when
 * the request fails, or when a newer mutation for the same peer replaces it.
 * <p>
 * Immutable: every mutator returns a new instance.
 */
public final class OverlayState {

    /**
     * One pending change.
     *
     * @param state  desired mute state (null = unmuted)
     * @param volume desired volume (null = unchanged/unknown)
     * @param handle cancels the request that will confirm or reject this change
     */
    public record PendingMuteChange(MuteState state, Integer volume, Cancellable handle) {
        public PendingMuteChange {
            Objects.requireNonNull(handle, "handle");
        }
    }

    private static final OverlayState EMPTY = new OverlayState(Map.of());

    private final Map<PeerId, PendingMuteChange> pending;

    private OverlayState(Map<PeerId, PendingMuteChange> pending) {
        this.pending = Map.copyOf(pending);
    }

    public static OverlayState empty() { return EMPTY; }

    /** Pending change for {@code peerId}, or null if none. */
    public PendingMuteChange get(PeerId peerId) {
        return pending.get(peerId);
    }

    public Map<PeerId, PendingMuteChange> entries() { return pending; }

    public boolean isEmpty() { return pending.isEmpty(); }

    public OverlayState with(PeerId peerId, PendingMuteChange change) {
        var m = new HashMap<>(pending);
        m.put(Objects.requireNonNull(peerId, "peerId"), Objects.requireNonNull(change, "change"));
        return new OverlayState(m);
    }

    public OverlayState without(PeerId peerId) {
        if (!pending.containsKey(peerId)) return this;
        var m = new HashMap<>(pending);
        m.remove(peerId);
        return new OverlayState(m);
    }

    public OverlayState withoutAll(Collection<PeerId> peerIds) {
        if (peerIds.isEmpty() || pending.isEmpty()) return this;
        var m = new HashMap<>(pending);
        boolean changed = false;
        for (PeerId id : peerIds) {
            changed |= m.remove(id) != null;
        }
        return changed ? new OverlayState(m) : this;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverlayState other)) return false;
        return pending.equals(other.pending);
    }

    @Override public int hashCode() { return pending.hashCode(); }

    @Override public String toString() { return "OverlayState" + pending.keySet(); }
}
