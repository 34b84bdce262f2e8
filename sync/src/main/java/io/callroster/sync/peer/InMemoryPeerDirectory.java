package io.callroster.sync.peer;

import io.callroster.core.PeerDirectory;
import io.callroster.core.PeerId;
import io.callroster.core.PeerRecord;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local peer directory.
 * <p>
 * The transport registers the peer records that come with fetched pages and
 * pushed updates; the engine only reads. Thread safe (transport threads write,
 * the call queue reads).
 */
public final class InMemoryPeerDirectory implements PeerDirectory {

    private final Map<PeerId, PeerRecord> peers = new ConcurrentHashMap<>();

    @Override
    public Optional<PeerRecord> find(PeerId id) {
        return Optional.ofNullable(peers.get(id));
    }

    public void put(PeerRecord peer) {
        Objects.requireNonNull(peer, "peer");
        peers.put(peer.id(), peer);
    }

    public void putAll(Collection<PeerRecord> records) {
        for (PeerRecord r : records) {
            put(r);
        }
    }

    public int size() { return peers.size(); }
}
