// file: src/main/java/io/callroster/sync/ParticipantsContext.java
package io.callroster.sync;

import io.callroster.core.Cancellable;
import io.callroster.core.EffectiveView;
import io.callroster.core.MuteState;
import io.callroster.core.OverlayState;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerId;
import io.callroster.core.update.CallSettingsUpdate;
import io.callroster.core.update.StateUpdate;
import io.callroster.core.update.Update;
import io.callroster.sync.net.ScopedUpdate;
import io.callroster.sync.process.ActivityDecayTimer;
import io.callroster.sync.process.FetchGate;
import io.callroster.sync.process.InternalState;
import io.callroster.sync.process.MissingParticipantResolver;
import io.callroster.sync.process.MutationCoordinator;
import io.callroster.sync.process.RosterPager;
import io.callroster.sync.process.RosterStore;
import io.callroster.sync.process.SpeakingActivityTracker;
import io.callroster.sync.process.UpdateProcessor;
import io.callroster.sync.queue.CallQueue;
import io.callroster.sync.stream.EventStream;
import io.callroster.sync.stream.ValueStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Client-side mirror of one call's participant roster.
 * <p>
 * Responsibilities:
 *  - own the call's {@link InternalState} and publish its effective view,
 *  - route pushed updates, speaking reports and local mutations to the engine
 *    components, all of which run on the call's {@link CallQueue},
 *  - expose the roster, the active speakers and join/leave events as streams.
 * <p>
 * Public operations may be called from any thread; they are posted to the
 * queue and return immediately. The queue belongs to the caller: {@link #close()}
 * stops this context's work on it but does not shut it down.
 */
public final class ParticipantsContext implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ParticipantsContext.class.getName());

    private final long callId;
    private final PeerId viewer;
    private final CallQueue queue;

    private final ValueStream<ParticipantsState> state;
    private final ValueStream<Set<PeerId>> activeSpeakers = new ValueStream<>(Set.of());
    private final EventStream<MemberEvent> memberEvents = new EventStream<>();

    private final RosterStore store;
    private final UpdateProcessor processor;
    private final MissingParticipantResolver resolver;
    private final RosterPager pager;
    private final MutationCoordinator mutations;
    private final SpeakingActivityTracker speaking;
    private final ActivityDecayTimer decay;

    private final List<Cancellable> subscriptions = new ArrayList<>();
    private volatile boolean terminated;
    private volatile boolean closed;

    /**
     * @param initial  roster snapshot the context starts from (usually the first fetched page)
     * @param previous service state of an earlier context of the same call, or null
     */
    public ParticipantsContext(
            long callId,
            PeerId viewer,
            ParticipantsState initial,
            ServiceState previous,
            SyncEnvironment env
    ) {
        this.callId = callId;
        this.viewer = Objects.requireNonNull(viewer, "viewer");
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(env, "env");
        this.queue = env.queue();
        SyncConfig config = env.config();

        this.state = new ValueStream<>(EffectiveView.project(initial, OverlayState.empty(), viewer));
        this.store = new RosterStore(new InternalState(initial, OverlayState.empty()),
                s -> state.set(EffectiveView.project(s.state(), s.overlay(), viewer)));

        FetchGate gate = new FetchGate();
        this.processor = new UpdateProcessor(callId, store, gate, env.network(), env.peers(), config,
                queue, memberEvents::emit, this::onFetchSlotFreed);
        this.resolver = new MissingParticipantResolver(callId, store, gate, env.network(), config,
                queue, this::onFetchSlotFreed);
        this.pager = new RosterPager(callId, store, gate, env.network(), config, queue, this::onFetchSlotFreed);
        this.mutations = new MutationCoordinator(callId, store, env.network(), queue, this::applyUpdates);
        this.speaking = new SpeakingActivityTracker(store, env.clock(),
                previous != null ? previous.nextActivityRank() : 0, resolver::ensureHave, activeSpeakers);
        this.decay = new ActivityDecayTimer(store, queue, env.clock(), config.decayPeriod(), config.activityRankTtl());

        queue.execute(decay::start);
        if (env.updateFeed() != null) {
            subscriptions.add(env.updateFeed().subscribe(this::onPushedUpdates));
        }
        if (env.activityFeed() != null) {
            subscriptions.add(env.activityFeed().subscribe(callId,
                    activity -> queue.execute(() -> {
                        if (!closed) speaking.onActivity(activity);
                    })));
        }
        log.fine(() -> "call " + callId + ": context started with " + initial.participants().size()
                + " participants at v" + initial.version());
    }

    /**
     * Fetch the first page of the roster and build a context on top of it.
     * The viewer's creator flag and the admin list are taken from that page.
     * The future completes on the call queue.
     */
    public static CompletableFuture<ParticipantsContext> load(
            long callId,
            PeerId viewer,
            ServiceState previous,
            SyncEnvironment env
    ) {
        return env.network()
                .fetchParticipants(callId, "", Set.of(), env.config().pageLimit(), null)
                .thenApplyAsync(page -> new ParticipantsContext(callId, viewer,
                        ParticipantsState.fromFetch(page.participants(), page.nextOffset(),
                                        page.sortAscending(), page.totalCount(), page.version())
                                .withCreator(page.isCreator())
                                .withAdminIds(page.adminIds()),
                        previous, env), env.queue());
    }

    public long callId() { return callId; }

    public PeerId viewer() { return viewer; }

    // ---- streams ----

    /** Effective roster for the viewer; replays the latest value, emits only on change. */
    public ValueStream<ParticipantsState> state() { return state; }

    /** Peers the audio activity feed currently reports as speaking. */
    public ValueStream<Set<PeerId>> activeSpeakers() { return activeSpeakers; }

    /** Joins and leaves observed through applied deltas. No replay. */
    public EventStream<MemberEvent> memberEvents() { return memberEvents; }

    /** Latest published effective roster, readable from any thread. */
    public ParticipantsState immediateState() { return state.get(); }

    public ServiceState serviceState() { return new ServiceState(speaking.nextActivityRank()); }

    /** True once a call-settings update reported the call as terminated. */
    public boolean isTerminated() { return terminated; }

    // ---- operations ----

    public void addUpdates(List<Update> updates) {
        List<Update> copy = List.copyOf(updates);
        post(() -> applyUpdates(copy));
    }

    public void updateAdminIds(Set<PeerId> adminIds) {
        Set<PeerId> copy = Set.copyOf(adminIds);
        post(() -> store.updateState(s -> s.withAdminIds(copy)));
    }

    /** @param speakers peer -> ssrc of everyone currently speaking */
    public void reportSpeakingParticipants(Map<PeerId, Long> speakers) {
        Map<PeerId, Long> copy = Map.copyOf(speakers);
        post(() -> speaking.report(copy));
    }

    public void ensureHaveParticipants(Set<Long> ssrcs) {
        Set<Long> copy = Set.copyOf(ssrcs);
        post(() -> resolver.ensureHave(copy));
    }

    public void updateMuteState(PeerId peerId, MuteState muteState, Integer volume, Boolean raiseHand) {
        Objects.requireNonNull(peerId, "peerId");
        post(() -> mutations.updateMuteState(peerId, muteState, volume, raiseHand));
    }

    public void raiseHand() {
        updateMuteState(viewer, null, null, true);
    }

    public void lowerHand() {
        updateMuteState(viewer, null, null, false);
    }

    public void updateShouldBeRecording(boolean shouldBeRecording, String title) {
        post(() -> mutations.updateShouldBeRecording(shouldBeRecording, title));
    }

    public void updateDefaultParticipantsAreMuted(boolean isMuted) {
        post(() -> mutations.updateDefaultParticipantsAreMuted(isMuted));
    }

    public void resetInviteLinks() {
        post(mutations::resetInviteLinks);
    }

    public void loadMore(String token) {
        post(() -> pager.loadMore(token));
    }

    /** Stop feeds, the decay timer and every in-flight request. Idempotent. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Cancellable c : subscriptions) {
            c.cancel();
        }
        subscriptions.clear();
        queue.execute(() -> {
            decay.stop();
            processor.close();
            resolver.close();
            pager.close();
            mutations.close();
            for (OverlayState.PendingMuteChange p : store.overlay().entries().values()) {
                p.handle().cancel();
            }
        });
        log.fine(() -> "call " + callId + ": context closed");
    }

    // ---- queue side ----

    private void post(Runnable task) {
        queue.execute(() -> {
            if (!closed) {
                task.run();
            }
        });
    }

    private void onPushedUpdates(List<ScopedUpdate> batch) {
        List<Update> mine = new ArrayList<>();
        for (ScopedUpdate u : batch) {
            if (u.callId() == callId) {
                mine.add(u.update());
            }
        }
        if (!mine.isEmpty()) {
            post(() -> applyUpdates(mine));
        }
    }

    private void applyUpdates(List<Update> updates) {
        List<StateUpdate> deltas = new ArrayList<>();
        for (Update u : updates) {
            if (u instanceof StateUpdate su) {
                deltas.add(su);
            } else if (u instanceof CallSettingsUpdate cs) {
                if (cs.isTerminated()) {
                    terminated = true;
                }
                store.updateState(s -> s.withCallSettings(
                        cs.defaultParticipantsAreMuted(), cs.title(), cs.recordingStartTimestamp()));
            }
        }
        processor.enqueue(deltas);
    }

    private void onFetchSlotFreed() {
        if (!processor.resumeDeferredResync()) {
            resolver.loadMissing();
        }
    }

    // visible for tests
    UpdateProcessor processor() { return processor; }
}
