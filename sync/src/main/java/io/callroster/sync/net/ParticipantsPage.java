package io.callroster.sync.net;

import io.callroster.core.Participant;
import io.callroster.core.PeerId;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One page returned by a participant fetch.
 *
 * @param participants  participants on this page (peer records already registered
 *                      in the peer directory by the transport)
 * @param nextOffset    cursor for the next page, null when exhausted
 * @param totalCount    server-side member count
 * @param version       delta-stream version the page was read at
 * @param sortAscending join-time sort direction of the call
 * @param isCreator     whether the viewer created the call
 * @param adminIds      peers with admin rights in the call
 */
public record ParticipantsPage(
        List<Participant> participants,
        String nextOffset,
        int totalCount,
        int version,
        boolean sortAscending,
        boolean isCreator,
        Set<PeerId> adminIds
) {
    public ParticipantsPage {
        participants = List.copyOf(Objects.requireNonNull(participants, "participants"));
        adminIds = Set.copyOf(Objects.requireNonNull(adminIds, "adminIds"));
    }

    /** Page without call-level capabilities (backfill and later pages). */
    public ParticipantsPage(List<Participant> participants, String nextOffset, int totalCount, int version,
                            boolean sortAscending) {
        this(participants, nextOffset, totalCount, version, sortAscending, false, Set.of());
    }
}
