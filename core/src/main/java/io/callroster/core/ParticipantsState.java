// file: src/main/java/io/callroster/core/ParticipantsState.java
package io.callroster.core;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of a call roster at one version of the delta stream.
 * <p>
 * Fields:
 *  - participants:                ordered roster (possibly one page of a larger call).
 *  - nextFetchOffset:             pagination cursor; null when nothing is left to load.
 *  - adminIds, isCreator:         capabilities of the viewer, used by the effective view.
 *  - defaultParticipantsAreMuted: "join muted" call setting.
 *  - sortAscending:               join-time direction for {@link ParticipantOrdering}.
 *  - recordingStartTimestamp:     null when the call is not recorded.
 *  - title:                       optional call title.
 *  - totalCount:                  server-side member count.
 *  - version:                     sequence number of the last applied delta.
 * <p>
 * Invariants (enforced here):
 *  - peerIds are unique within participants.
 *  - 0 <= participants.size() <= totalCount.
 */
public record ParticipantsState(
        List<Participant> participants,
        String nextFetchOffset,
        Set<PeerId> adminIds,
        boolean isCreator,
        DefaultParticipantsAreMuted defaultParticipantsAreMuted,
        boolean sortAscending,
        Integer recordingStartTimestamp,
        String title,
        int totalCount,
        int version
) {
    public ParticipantsState {
        participants = List.copyOf(Objects.requireNonNull(participants, "participants"));
        adminIds = Set.copyOf(Objects.requireNonNull(adminIds, "adminIds"));
        Objects.requireNonNull(defaultParticipantsAreMuted, "defaultParticipantsAreMuted");

        Set<PeerId> seen = new HashSet<>();
        for (Participant p : participants) {
            if (!seen.add(p.peerId())) {
                throw new IllegalArgumentException("duplicate participant " + p.peerId());
            }
        }
        totalCount = Math.max(Math.max(0, totalCount), participants.size());
    }

    /**
     * Snapshot as returned by a participant fetch: roster data only, call-level
     * settings at their defaults. Participants are sorted here.
     */
    public static ParticipantsState fromFetch(
            List<Participant> participants,
            String nextFetchOffset,
            boolean sortAscending,
            int totalCount,
            int version
    ) {
        return new ParticipantsState(
                ParticipantOrdering.sorted(participants, sortAscending),
                nextFetchOffset,
                Set.of(),
                false,
                DefaultParticipantsAreMuted.off(),
                sortAscending,
                null,
                null,
                totalCount,
                version
        );
    }

    public Optional<Participant> find(PeerId peerId) {
        for (Participant p : participants) {
            if (p.peerId().equals(peerId)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /** Replace the roster together with its count and version (the only way deltas land). */
    public ParticipantsState withRoster(List<Participant> newParticipants, int newTotalCount, int newVersion) {
        return new ParticipantsState(newParticipants, nextFetchOffset, adminIds, isCreator,
                defaultParticipantsAreMuted, sortAscending, recordingStartTimestamp, title,
                newTotalCount, newVersion);
    }

    /** Replace the roster, keeping count and version. */
    public ParticipantsState withParticipants(List<Participant> newParticipants) {
        return withRoster(newParticipants, totalCount, version);
    }

    public ParticipantsState withNextFetchOffset(String offset) {
        return new ParticipantsState(participants, offset, adminIds, isCreator,
                defaultParticipantsAreMuted, sortAscending, recordingStartTimestamp, title,
                totalCount, version);
    }

    public ParticipantsState withAdminIds(Set<PeerId> ids) {
        return new ParticipantsState(participants, nextFetchOffset, ids, isCreator,
                defaultParticipantsAreMuted, sortAscending, recordingStartTimestamp, title,
                totalCount, version);
    }

    public ParticipantsState withCreator(boolean creator) {
        return new ParticipantsState(participants, nextFetchOffset, adminIds, creator,
                defaultParticipantsAreMuted, sortAscending, recordingStartTimestamp, title,
                totalCount, version);
    }

    public ParticipantsState withDefaultParticipantsAreMuted(DefaultParticipantsAreMuted value) {
        return new ParticipantsState(participants, nextFetchOffset, adminIds, isCreator,
                value, sortAscending, recordingStartTimestamp, title,
                totalCount, version);
    }

    /** Apply the non-versioned call settings carried by a call update. */
    public ParticipantsState withCallSettings(
            DefaultParticipantsAreMuted defaults,
            String newTitle,
            Integer newRecordingStartTimestamp
    ) {
        return new ParticipantsState(participants, nextFetchOffset, adminIds, isCreator,
                defaults, sortAscending, newRecordingStartTimestamp, newTitle,
                totalCount, version);
    }

    /**
     * Copy call-level settings from {@code other} onto this snapshot.
     * Used when a freshly fetched snapshot replaces local state: the fetch only
     * carries roster data.
     */
    public ParticipantsState withSettingsOf(ParticipantsState other) {
        return new ParticipantsState(participants, nextFetchOffset, other.adminIds, other.isCreator,
                other.defaultParticipantsAreMuted, sortAscending, other.recordingStartTimestamp,
                other.title, totalCount, version);
    }
}
