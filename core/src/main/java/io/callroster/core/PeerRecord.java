package io.callroster.core;

import java.util.Objects;

/** Identity record returned by the {@link PeerDirectory}. */
public record PeerRecord(PeerId id, String displayName) {
    public PeerRecord {
        Objects.requireNonNull(id, "id");
    }
}
