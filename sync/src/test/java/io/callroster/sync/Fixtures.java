package io.callroster.sync;

import io.callroster.core.Participant;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerId;
import io.callroster.core.PeerRecord;
import io.callroster.core.update.ParticipantUpdate;
import io.callroster.core.update.StateUpdate;
import io.callroster.sync.net.ParticipantsPage;
import io.callroster.sync.peer.InMemoryPeerDirectory;

import java.util.List;

/** Shared builders for engine tests. Participant {@code n} always owns ssrc {@code n * 10}. */
public final class Fixtures {

    public static final long CALL = 42L;

    private Fixtures() {
    }

    public static Participant p(long id, int join) {
        return new Participant(PeerId.of(id), id * 10, null, join, null, null, null, null, null, null);
    }

    public static ParticipantUpdate joined(long id, int join) {
        return update(id, join, ParticipantUpdate.Status.JOINED);
    }

    public static ParticipantUpdate update(long id, int join, ParticipantUpdate.Status status) {
        return new ParticipantUpdate(PeerId.of(id), id * 10, null, join, null, null, null, status, null, null, false);
    }

    public static StateUpdate delta(int version, ParticipantUpdate... updates) {
        return new StateUpdate(List.of(updates), version);
    }

    /** Descending join order, no pagination cursor, totalCount = size. */
    public static ParticipantsState state(int version, Participant... participants) {
        return ParticipantsState.fromFetch(List.of(participants), null, false, participants.length, version);
    }

    public static ParticipantsPage page(int version, String nextOffset, int totalCount, Participant... participants) {
        return new ParticipantsPage(List.of(participants), nextOffset, totalCount, version, false);
    }

    public static InMemoryPeerDirectory peers(long... ids) {
        InMemoryPeerDirectory dir = new InMemoryPeerDirectory();
        for (long id : ids) {
            dir.put(new PeerRecord(PeerId.of(id), "peer-" + id));
        }
        return dir;
    }

    public static List<Long> ids(ParticipantsState state) {
        return state.participants().stream().map(p -> p.peerId().value()).toList();
    }
}
