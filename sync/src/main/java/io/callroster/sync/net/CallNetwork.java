// file: src/main/java/io/callroster/sync/net/CallNetwork.java
package io.callroster.sync.net;

import io.callroster.core.MuteState;
import io.callroster.core.PeerId;
import io.callroster.core.update.Update;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response side of the transport, as seen by the sync engine.
 * <p>
 * All methods are asynchronous. A failed request completes the future
 * exceptionally (typically with {@link CallNetworkException}); the engine
 * never blocks on these futures and re-delivers completions on its own
 * call queue.
 * <p>
 * Implementations:
 *  - HTTP/JSON gateway client in the server module,
 *  - in-memory fakes in tests.
 */
public interface CallNetwork {

    /**
     * Fetch participants of a call.
     *
     * @param callId        call to read
     * @param offset        pagination cursor, "" for the first page
     * @param ssrcs         when non-empty, only participants owning these media sources
     * @param limit         page size
     * @param sortAscending join-time direction; null lets the server use the call's setting
     */
    CompletableFuture<ParticipantsPage> fetchParticipants(
            long callId,
            String offset,
            Set<Long> ssrcs,
            int limit,
            Boolean sortAscending
    );

    /**
     * Change mute state, volume or raised hand of one participant.
     * Null arguments are "not part of this change".
     *
     * @return authoritative updates produced by the change
     */
    CompletableFuture<List<Update>> editParticipant(
            long callId,
            PeerId peerId,
            MuteState muteState,
            Integer volume,
            Boolean raiseHand
    );

    /** Start or stop recording; {@code title} names the recording when non-empty. */
    CompletableFuture<List<Update>> toggleRecording(long callId, boolean shouldRecord, String title);

    /** Change the call's "join muted" setting. */
    CompletableFuture<List<Update>> toggleDefaultMuted(long callId, boolean isMuted);

    /** Invalidate the call's invite links. */
    CompletableFuture<List<Update>> resetInviteLinks(long callId);
}
