package io.callroster.sync.process;

import io.callroster.core.Participant;
import io.callroster.core.ParticipantOrdering;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerId;
import io.callroster.sync.stream.ValueStream;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Turns speaking signals into activity timestamps and ranks.
 * <p>
 * Two sources:
 *  - explicit reports ({@link #report}): timestamp set to now and, for newly
 *    active peers, a fresh rank from the monotonic counter;
 *  - the automatic audio activity feed ({@link #onActivity}): drives the
 *    active-speakers set and, until the first explicit report arrives, raises
 *    timestamps without assigning ranks.
 */
public final class SpeakingActivityTracker {

    private final RosterStore store;
    private final Clock clock;
    private final Consumer<Set<Long>> ensureHave;
    private final ValueStream<Set<PeerId>> activeSpeakers;

    private volatile int nextActivityRank;
    private boolean hasReceivedReport;

    public SpeakingActivityTracker(
            RosterStore store,
            Clock clock,
            int nextActivityRank,
            Consumer<Set<Long>> ensureHave,
            ValueStream<Set<PeerId>> activeSpeakers
    ) {
        if (nextActivityRank < 0) throw new IllegalArgumentException("nextActivityRank must be >= 0");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nextActivityRank = nextActivityRank;
        this.ensureHave = Objects.requireNonNull(ensureHave, "ensureHave");
        this.activeSpeakers = Objects.requireNonNull(activeSpeakers, "activeSpeakers");
    }

    public int nextActivityRank() { return nextActivityRank; }

    /** @param speakers peer -> ssrc of everyone currently speaking */
    public void report(Map<PeerId, Long> speakers) {
        if (!speakers.isEmpty()) {
            hasReceivedReport = true;
        }
        double now = clock.millis() / 1000.0;

        ParticipantsState state = store.state();
        List<Participant> out = new ArrayList<>(state.participants().size());
        boolean changed = false;
        for (Participant p : state.participants()) {
            if (speakers.containsKey(p.peerId())
                    && (p.activityTimestamp() == null || p.activityTimestamp() < now)) {
                p = p.withActivityTimestamp(now);
                if (p.activityRank() == null) {
                    p = p.withActivityRank(nextActivityRank++);
                }
                changed = true;
            }
            out.add(p);
        }
        if (changed) {
            store.updateState(s -> s.withParticipants(ParticipantOrdering.sorted(out, s.sortAscending())));
        }

        Set<Long> ssrcs = new HashSet<>();
        for (Long ssrc : speakers.values()) {
            if (ssrc != null) ssrcs.add(ssrc);
        }
        ensureHave.accept(ssrcs);
    }

    /** @param activity peer -> speaking timestamp (seconds) from the audio activity feed */
    public void onActivity(Map<PeerId, Integer> activity) {
        activeSpeakers.set(Set.copyOf(activity.keySet()));
        if (hasReceivedReport) {
            return;
        }

        ParticipantsState state = store.state();
        List<Participant> out = new ArrayList<>(state.participants().size());
        boolean changed = false;
        for (Participant p : state.participants()) {
            Integer ts = activity.get(p.peerId());
            if (ts != null && (p.activityTimestamp() == null || p.activityTimestamp() < ts)) {
                p = p.withActivityTimestamp(ts.doubleValue());
                changed = true;
            }
            out.add(p);
        }
        if (changed) {
            store.updateState(s -> s.withParticipants(ParticipantOrdering.sorted(out, s.sortAscending())));
        }
    }
}
