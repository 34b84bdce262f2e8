package io.callroster.server;

import io.callroster.sync.ParticipantsContext;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Contexts of the calls this process follows, by call id. */
public final class CallRegistry {

    private final Map<Long, ParticipantsContext> contexts = new ConcurrentHashMap<>();

    public void register(ParticipantsContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        ParticipantsContext previous = contexts.put(ctx.callId(), ctx);
        if (previous != null && previous != ctx) {
            previous.close();
        }
    }

    public Optional<ParticipantsContext> find(long callId) {
        return Optional.ofNullable(contexts.get(callId));
    }

    public Collection<ParticipantsContext> all() {
        return List.copyOf(contexts.values());
    }

    public void closeAll() {
        for (ParticipantsContext ctx : all()) {
            ctx.close();
        }
        contexts.clear();
    }
}
