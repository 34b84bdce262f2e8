package io.callroster.sync.net;

import io.callroster.core.update.Update;

import java.util.Objects;

/** An update tagged with the call it belongs to, as delivered by the shared push feed. */
public record ScopedUpdate(long callId, Update update) {
    public ScopedUpdate {
        Objects.requireNonNull(update, "update");
    }
}
