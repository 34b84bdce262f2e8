// file: src/main/java/io/callroster/core/update/ParticipantUpdate.java
package io.callroster.core.update;

import io.callroster.core.MuteState;
import io.callroster.core.Participant;
import io.callroster.core.PeerId;

import java.util.Objects;

/**
 * Change to a single participant inside a {@link StateUpdate}.
 * <p>
 * isMin marks a reduced projection sent to viewers who are not entitled to
 * the full record: its muteState and volume do not reflect the viewer's own
 * local choices, so those are taken from what we already know instead.
 */
public record ParticipantUpdate(
        PeerId peerId,
        Long ssrc,
        String jsonParams,
        int joinTimestamp,
        Double activityTimestamp,
        Long raiseHandRating,
        MuteState muteState,
        Status status,
        Integer volume,
        String about,
        boolean isMin
) {
    /** Membership transition carried by the update. */
    public enum Status { NONE, JOINED, LEFT }

    public ParticipantUpdate {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(status, "status");
    }

    public static ParticipantUpdate left(PeerId peerId) {
        return new ParticipantUpdate(peerId, null, null, 0, null, null, null, Status.LEFT, null, null, false);
    }

    /**
     * Build the participant this update describes, merged with what was known before.
     * <p>
     * Rules:
     *  - joinTimestamp and activityRank are kept from {@code previous}.
     *  - activityTimestamp never regresses: max of previous and incoming.
     *  - for isMin updates, a previous muteState that the viewer set (mutedByYou)
     *    and a previously known volume survive.
     *  - everything else comes from this update.
     *
     * @param previous participant currently in the roster, or null on first appearance
     */
    public Participant applyTo(Participant previous) {
        Double activity = activityTimestamp;
        if (previous != null && previous.activityTimestamp() != null) {
            activity = activity == null
                    ? previous.activityTimestamp()
                    : Math.max(activity, previous.activityTimestamp());
        }

        MuteState mute = muteState;
        Integer vol = volume;
        if (isMin && previous != null) {
            if (previous.muteState() != null && previous.muteState().mutedByYou()) {
                mute = previous.muteState();
            }
            if (previous.volume() != null) {
                vol = previous.volume();
            }
        }

        return new Participant(
                peerId,
                ssrc,
                jsonParams,
                previous != null ? previous.joinTimestamp() : joinTimestamp,
                raiseHandRating,
                activity,
                previous != null ? previous.activityRank() : null,
                mute,
                vol,
                about
        );
    }
}
