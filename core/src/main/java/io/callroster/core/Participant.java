// file: src/main/java/io/callroster/core/Participant.java
package io.callroster.core;

import java.util.Objects;

/**
 * Immutable view of one call member as known to this client.
 * <p>
 * Fields:
 *  - peerId:            unique key within a roster.
 *  - ssrc:              media-source id; null until media is attached.
 *  - jsonParams:        opaque passthrough.
 *  - joinTimestamp:     server-assigned join time (seconds), stable once set.
 *  - raiseHandRating:   present iff the hand is raised; larger = raised more recently.
 *  - activityTimestamp: last speaking time (seconds, fractional); never regresses.
 *  - activityRank:      local recency marker for "recently active"; lower = promoted earlier.
 *  - muteState:         null means unmuted and not muted by the viewer.
 *  - volume, about:     opaque passthrough.
 * <p>
 * activityRank and, partly, activityTimestamp are local annotations: the server
 * knows nothing about ranks, so every merge path must carry them over.
 */
public record Participant(
        PeerId peerId,
        Long ssrc,
        String jsonParams,
        int joinTimestamp,
        Long raiseHandRating,
        Double activityTimestamp,
        Integer activityRank,
        MuteState muteState,
        Integer volume,
        String about
) {
    public Participant {
        Objects.requireNonNull(peerId, "peerId");
    }

    public boolean hasRaiseHand() { return raiseHandRating != null; }

    public Participant withJoinTimestamp(int value) {
        return new Participant(peerId, ssrc, jsonParams, value, raiseHandRating,
                activityTimestamp, activityRank, muteState, volume, about);
    }

    public Participant withRaiseHandRating(Long value) {
        return new Participant(peerId, ssrc, jsonParams, joinTimestamp, value,
                activityTimestamp, activityRank, muteState, volume, about);
    }

    public Participant withActivityTimestamp(Double value) {
        return new Participant(peerId, ssrc, jsonParams, joinTimestamp, raiseHandRating,
                value, activityRank, muteState, volume, about);
    }

    public Participant withActivityRank(Integer value) {
        return new Participant(peerId, ssrc, jsonParams, joinTimestamp, raiseHandRating,
                activityTimestamp, value, muteState, volume, about);
    }

    public Participant withMute(MuteState state, Integer newVolume) {
        return new Participant(peerId, ssrc, jsonParams, joinTimestamp, raiseHandRating,
                activityTimestamp, activityRank, state, newVolume, about);
    }

    @Override
    public String toString() {
        return "Participant(peer: " + peerId + ", ssrc: " + ssrc + ")";
    }
}
