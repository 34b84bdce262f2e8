package io.callroster.sync.process;

import io.callroster.core.Cancellable;
import io.callroster.core.Participant;
import io.callroster.core.ParticipantOrdering;
import io.callroster.core.ParticipantsState;
import io.callroster.sync.queue.CallQueue;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Periodically demotes participants that stopped speaking: an activity rank is
 * cleared once its timestamp is missing or older than the ttl.
 */
public final class ActivityDecayTimer {

    private final RosterStore store;
    private final CallQueue queue;
    private final Clock clock;
    private final Duration period;
    private final double ttlSeconds;

    private Cancellable handle;

    public ActivityDecayTimer(RosterStore store, CallQueue queue, Clock clock, Duration period, Duration ttl) {
        this.store = Objects.requireNonNull(store, "store");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.period = Objects.requireNonNull(period, "period");
        this.ttlSeconds = Objects.requireNonNull(ttl, "ttl").toMillis() / 1000.0;
    }

    public void start() {
        if (handle == null) {
            handle = queue.scheduleAtFixedRate(this::sweep, period);
        }
    }

    public void stop() {
        if (handle != null) {
            handle.cancel();
            handle = null;
        }
    }

    /** One decay pass; must run on the call queue. */
    public void sweep() {
        double now = clock.millis() / 1000.0;
        ParticipantsState state = store.state();
        List<Participant> out = new ArrayList<>(state.participants().size());
        boolean changed = false;
        for (Participant p : state.participants()) {
            if (p.activityRank() != null
                    && (p.activityTimestamp() == null || now - p.activityTimestamp() > ttlSeconds)) {
                p = p.withActivityRank(null);
                changed = true;
            }
            out.add(p);
        }
        if (changed) {
            store.updateState(s -> s.withParticipants(ParticipantOrdering.sorted(out, s.sortAscending())));
        }
    }
}
