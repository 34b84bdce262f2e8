// file: src/main/java/io/callroster/core/EffectiveView.java
package io.callroster.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-time projection of authoritative state for one viewer.
 * <p>
 * Two layers are applied, neither of which touches the input:
 *  1) Overlay: a pending mute change replaces the participant's muteState and volume.
 *  2) Capabilities: a viewer who is neither creator nor admin cannot act on raised
 *     hands, so raiseHandRating is cleared and the list is re-sorted without it.
 */
public final class EffectiveView {

    private EffectiveView() {
        // utility
    }

    public static ParticipantsState project(ParticipantsState state, OverlayState overlay, PeerId viewer) {
        boolean canSeeHands = state.isCreator() || state.adminIds().contains(viewer);
        if (overlay.isEmpty() && canSeeHands) {
            return state;
        }

        boolean sortAgain = false;
        List<Participant> out = new ArrayList<>(state.participants().size());
        for (Participant p : state.participants()) {
            OverlayState.PendingMuteChange pending = overlay.get(p.peerId());
            if (pending != null) {
                p = p.withMute(pending.state(), pending.volume());
            }
            if (!canSeeHands && p.raiseHandRating() != null) {
                p = p.withRaiseHandRating(null);
                sortAgain = true;
            }
            out.add(p);
        }
        if (sortAgain) {
            out.sort(ParticipantOrdering.comparator(state.sortAscending()));
        }
        return state.withParticipants(out);
    }
}
