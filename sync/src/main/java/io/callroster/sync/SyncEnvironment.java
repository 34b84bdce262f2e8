package io.callroster.sync;

import io.callroster.core.PeerDirectory;
import io.callroster.sync.net.CallNetwork;
import io.callroster.sync.net.CallUpdateFeed;
import io.callroster.sync.net.SpeakingActivityFeed;
import io.callroster.sync.queue.CallQueue;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators a {@link ParticipantsContext} runs against.
 *
 * @param network      request/response transport
 * @param peers        peer identity store (read only)
 * @param updateFeed   pushed updates; null when updates are fed manually via addUpdates
 * @param activityFeed audio activity; null when not available
 * @param queue        serialization point of the call, owned by the caller
 * @param clock        wall clock used for activity timestamps
 * @param config       engine tunables
 */
public record SyncEnvironment(
        CallNetwork network,
        PeerDirectory peers,
        CallUpdateFeed updateFeed,
        SpeakingActivityFeed activityFeed,
        CallQueue queue,
        Clock clock,
        SyncConfig config
) {
    public SyncEnvironment {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(peers, "peers");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(config, "config");
    }
}
