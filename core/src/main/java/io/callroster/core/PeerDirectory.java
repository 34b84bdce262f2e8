// file: src/main/java/io/callroster/core/PeerDirectory.java
package io.callroster.core;

import java.util.Optional;

/**
 * Read-only view of the peer identity store.
 * <p>
 * The store itself lives outside the sync engine (a persistent key-value peer
 * store in a real client). The engine only asks one question: "is this peer id
 * known?". Deltas naming unknown peers are not applied.
 * <p>
 * Implementations must answer synchronously.
 */
public interface PeerDirectory {

    /** Look up a peer by id; empty when the peer is unknown. */
    Optional<PeerRecord> find(PeerId id);

    default boolean contains(PeerId id) {
        return find(id).isPresent();
    }
}
