// file: src/main/java/io/callroster/core/update/StateUpdate.java
package io.callroster.core.update;

import io.callroster.core.PeerId;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Versioned roster delta.
 *
 * @param participantUpdates      per-participant changes, applied in order
 * @param version                 position in the delta stream
 * @param removePendingMuteStates peers whose optimistic overlay entry this delta
 *                                confirms; cleared even when the delta is stale
 */
public record StateUpdate(
        List<ParticipantUpdate> participantUpdates,
        int version,
        Set<PeerId> removePendingMuteStates
) implements Update {
    public StateUpdate {
        participantUpdates = List.copyOf(Objects.requireNonNull(participantUpdates, "participantUpdates"));
        removePendingMuteStates = Set.copyOf(Objects.requireNonNull(removePendingMuteStates, "removePendingMuteStates"));
    }

    public StateUpdate(List<ParticipantUpdate> participantUpdates, int version) {
        this(participantUpdates, version, Set.of());
    }

    /** Same delta, additionally confirming the pending change of {@code peerId}. */
    public StateUpdate confirming(PeerId peerId) {
        var ids = new HashSet<>(removePendingMuteStates);
        ids.add(peerId);
        return new StateUpdate(participantUpdates, version, ids);
    }
}
