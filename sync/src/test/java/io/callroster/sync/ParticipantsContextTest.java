package io.callroster.sync;

import io.callroster.core.Cancellable;
import io.callroster.core.DefaultParticipantsAreMuted;
import io.callroster.core.MuteState;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerId;
import io.callroster.core.update.CallSettingsUpdate;
import io.callroster.core.update.ParticipantUpdate;
import io.callroster.core.update.StateUpdate;
import io.callroster.sync.net.FakeCallNetwork;
import io.callroster.sync.net.ParticipantsPage;
import io.callroster.sync.net.CallUpdateFeed;
import io.callroster.sync.net.ScopedUpdate;
import io.callroster.sync.net.SpeakingActivityFeed;
import io.callroster.sync.peer.InMemoryPeerDirectory;
import io.callroster.sync.process.UpdateProcessor;
import io.callroster.sync.queue.ManualCallQueue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static io.callroster.sync.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behavior of one call's context with every collaborator faked and
 * the call queue driven by hand.
 */
class ParticipantsContextTest {

    private static final PeerId VIEWER = PeerId.of(1);

    private final ManualCallQueue queue = new ManualCallQueue();
    private final FakeCallNetwork network = new FakeCallNetwork();
    private final InMemoryPeerDirectory peers = peers(1, 2, 3, 4, 5);
    private final FakeUpdateFeed updateFeed = new FakeUpdateFeed();
    private final FakeActivityFeed activityFeed = new FakeActivityFeed();
    private final MutableClock clock = MutableClock.atSeconds(50_000);

    private SyncEnvironment env() {
        return new SyncEnvironment(network, peers, updateFeed, activityFeed, queue, clock, SyncConfig.defaults());
    }

    private ParticipantsContext open(ParticipantsState initial, ServiceState previous) {
        var ctx = new ParticipantsContext(CALL, VIEWER, initial, previous, env());
        queue.runAll();
        return ctx;
    }

    private ParticipantsContext open(ParticipantsState initial) {
        return open(initial.withCreator(true), null);
    }

    @Test
    void load_builds_the_context_from_the_first_page() {
        CompletableFuture<ParticipantsContext> loading = ParticipantsContext.load(CALL, VIEWER, null, env());

        FakeCallNetwork.Fetch f = network.lastFetch();
        assertEquals("", f.offset());
        assertNull(f.sortAscending(), "first fetch lets the server pick the direction");
        f.result().complete(page(3, "p2", 10, p(1, 100), p(2, 200)));
        queue.runAll();

        ParticipantsContext ctx = loading.join();
        assertEquals(List.of(2L, 1L), ids(ctx.immediateState()));
        assertEquals(10, ctx.immediateState().totalCount());
        assertEquals("p2", ctx.immediateState().nextFetchOffset());
    }

    @Test
    void load_takes_creator_flag_and_admins_from_the_first_page() {
        var raised = p(2, 200).withRaiseHandRating(5L);

        CompletableFuture<ParticipantsContext> asCreator = ParticipantsContext.load(CALL, VIEWER, null, env());
        network.lastFetch().result().complete(
                new ParticipantsPage(List.of(p(1, 100), raised), null, 2, 3, false, true, Set.of(PeerId.of(4))));
        queue.runAll();

        ParticipantsState s = asCreator.join().immediateState();
        assertTrue(s.isCreator());
        assertEquals(Set.of(PeerId.of(4)), s.adminIds());
        assertEquals(5L, s.find(PeerId.of(2)).orElseThrow().raiseHandRating(), "creator sees raised hands");

        CompletableFuture<ParticipantsContext> asMember = ParticipantsContext.load(CALL, VIEWER, null, env());
        network.lastFetch().result().complete(page(3, null, 2, p(1, 100), raised));
        queue.runAll();

        ParticipantsState m = asMember.join().immediateState();
        assertFalse(m.isCreator());
        assertNull(m.find(PeerId.of(2)).orElseThrow().raiseHandRating());
    }

    @Test
    void pushed_deltas_for_this_call_are_applied_and_published() {
        var ctx = open(state(5, p(1, 100), p(2, 200)));
        List<ParticipantsState> seen = new ArrayList<>();
        List<MemberEvent> events = new ArrayList<>();
        ctx.state().subscribe(seen::add);
        ctx.memberEvents().subscribe(events::add);

        updateFeed.push(List.of(
                new ScopedUpdate(CALL + 1, delta(6, joined(4, 10))),
                new ScopedUpdate(CALL, delta(6, joined(3, 150)))));
        queue.runAll();

        assertEquals(List.of(2L, 3L, 1L), ids(ctx.immediateState()));
        assertEquals(2, seen.size(), "replayed value plus one change");
        assertEquals(List.of(new MemberEvent(PeerId.of(3), true)), events);
    }

    @Test
    void confirmed_mute_change_shows_server_value() {
        var ctx = open(state(5, p(1, 100), p(2, 200)));
        PeerId x = PeerId.of(2);
        MuteState muted = new MuteState(true, false);

        ctx.updateMuteState(x, muted, null, null);
        queue.runAll();
        assertEquals(muted, ctx.immediateState().find(x).orElseThrow().muteState(), "optimistic");

        // the server decides otherwise and confirms the pending change
        var u = new ParticipantUpdate(x, 20L, null, 200, null, null, null, ParticipantUpdate.Status.NONE, null, null, false);
        ctx.addUpdates(List.of(new StateUpdate(List.of(u), 6, Set.of(x))));
        queue.runAll();

        assertNull(ctx.immediateState().find(x).orElseThrow().muteState());
    }

    @Test
    void mutation_response_goes_through_the_update_path() {
        var ctx = open(state(5, p(1, 100), p(2, 200)));
        PeerId x = PeerId.of(2);
        MuteState muted = new MuteState(true, false);

        ctx.updateMuteState(x, muted, null, null);
        queue.runAll();
        var u = new ParticipantUpdate(x, 20L, null, 200, null, null, muted, ParticipantUpdate.Status.NONE, null, null, false);
        network.lastEdit().result().complete(List.of(new StateUpdate(List.of(u), 6)));
        queue.runAll();

        assertEquals(6, ctx.immediateState().version());
        assertEquals(muted, ctx.immediateState().find(x).orElseThrow().muteState());
    }

    @Test
    void speaking_report_promotes_and_backfills() {
        var ctx = open(state(5, p(1, 100), p(2, 200), p(3, 300)), new ServiceState(5));

        ctx.reportSpeakingParticipants(Map.of(PeerId.of(1), 10L, PeerId.of(4), 40L));
        queue.runAll();

        var first = ctx.immediateState().participants().get(0);
        assertEquals(PeerId.of(1), first.peerId());
        assertEquals(5, first.activityRank());
        assertEquals(new ServiceState(6), ctx.serviceState());
        assertEquals(Set.of(40L), network.lastFetch().ssrcs());
    }

    @Test
    void gap_during_backfill_resyncs_right_after_it() {
        var ctx = open(state(5, p(1, 100)));

        ctx.ensureHaveParticipants(Set.of(20L));
        queue.runAll();
        FakeCallNetwork.Fetch backfill = network.lastFetch();

        ctx.addUpdates(List.of(delta(9, joined(3, 300))));
        queue.runAll();
        assertEquals(1, network.fetches.size(), "resync waits for the backfill");
        assertEquals(UpdateProcessor.Phase.RESYNCING_FROM_SERVER, ctx.processor().phase());

        backfill.result().complete(page(5, null, 2, p(2, 200)));
        queue.runAll();
        assertEquals(2, network.fetches.size());
        FakeCallNetwork.Fetch resync = network.lastFetch();
        assertTrue(resync.ssrcs().isEmpty());

        resync.result().complete(page(9, null, 3, p(1, 100), p(2, 200), p(3, 300)));
        queue.runAll();
        assertEquals(9, ctx.immediateState().version());
        assertEquals(List.of(3L, 2L, 1L), ids(ctx.immediateState()));
        assertEquals(UpdateProcessor.Phase.IDLE, ctx.processor().phase());
    }

    @Test
    void call_settings_apply_immediately() {
        var ctx = open(state(5, p(1, 100)));

        ctx.addUpdates(List.of(new CallSettingsUpdate(false, new DefaultParticipantsAreMuted(true, false), "retro", 1234)));
        queue.runAll();

        ParticipantsState s = ctx.immediateState();
        assertEquals("retro", s.title());
        assertEquals(1234, s.recordingStartTimestamp());
        assertTrue(s.defaultParticipantsAreMuted().isMuted());
        assertEquals(5, s.version(), "settings are not versioned");
        assertFalse(ctx.isTerminated());

        ctx.addUpdates(List.of(new CallSettingsUpdate(true, DefaultParticipantsAreMuted.off(), null, null)));
        queue.runAll();
        assertTrue(ctx.isTerminated());
    }

    @Test
    void raised_hands_become_visible_when_viewer_becomes_admin() {
        var ctx = open(state(5, p(1, 100), p(2, 200).withRaiseHandRating(9L)), null);
        assertNull(ctx.immediateState().find(PeerId.of(2)).orElseThrow().raiseHandRating());

        ctx.updateAdminIds(Set.of(VIEWER));
        queue.runAll();

        assertEquals(9L, ctx.immediateState().find(PeerId.of(2)).orElseThrow().raiseHandRating());
    }

    @Test
    void raise_hand_targets_the_viewer() {
        var ctx = open(state(5, p(1, 100)));

        ctx.raiseHand();
        queue.runAll();

        assertEquals(VIEWER, network.lastEdit().peerId());
        assertEquals(Boolean.TRUE, network.lastEdit().raiseHand());
    }

    @Test
    void audio_feed_drives_active_speakers() {
        var ctx = open(state(5, p(1, 100), p(2, 200)));

        activityFeed.push(Map.of(PeerId.of(1), 49_990));
        queue.runAll();

        assertEquals(Set.of(PeerId.of(1)), ctx.activeSpeakers().get());
        assertEquals(List.of(1L, 2L), ids(ctx.immediateState()));
    }

    @Test
    void decay_timer_runs_on_the_call_queue() {
        var ctx = open(state(5, p(1, 100), p(2, 200)));
        ctx.reportSpeakingParticipants(Map.of(PeerId.of(1), 10L));
        queue.runAll();
        assertEquals(0, ctx.immediateState().participants().get(0).activityRank());

        clock.advance(Duration.ofSeconds(61));
        queue.advance(Duration.ofSeconds(10));

        assertNull(ctx.immediateState().find(PeerId.of(1)).orElseThrow().activityRank());
    }

    @Test
    void invalid_load_more_token_changes_nothing() {
        var ctx = open(state(5, p(1, 100)).withNextFetchOffset("abc"));
        ParticipantsState before = ctx.immediateState();

        ctx.loadMore("xyz");
        queue.runAll();

        assertTrue(network.fetches.isEmpty());
        assertEquals(before, ctx.immediateState());
    }

    @Test
    void close_stops_feeds_timer_and_requests() {
        var ctx = open(state(5, p(1, 100), p(2, 200)));
        ctx.updateMuteState(PeerId.of(2), new MuteState(true, false), null, null);
        queue.runAll();
        var edit = network.lastEdit();

        ctx.close();
        queue.runAll();

        assertEquals(0, updateFeed.listeners.size());
        assertEquals(0, activityFeed.listeners.size());
        assertEquals(0, queue.activeTimers());
        assertTrue(edit.result().isCancelled());

        ctx.addUpdates(List.of(delta(6, joined(3, 150))));
        queue.runAll();
        assertEquals(5, ctx.immediateState().version());
    }

    private static final class FakeUpdateFeed implements CallUpdateFeed {
        final List<Consumer<List<ScopedUpdate>>> listeners = new CopyOnWriteArrayList<>();

        @Override
        public Cancellable subscribe(Consumer<List<ScopedUpdate>> listener) {
            listeners.add(listener);
            return () -> listeners.remove(listener);
        }

        void push(List<ScopedUpdate> batch) {
            for (var l : listeners) l.accept(batch);
        }
    }

    private static final class FakeActivityFeed implements SpeakingActivityFeed {
        final List<Consumer<Map<PeerId, Integer>>> listeners = new CopyOnWriteArrayList<>();

        @Override
        public Cancellable subscribe(long callId, Consumer<Map<PeerId, Integer>> listener) {
            listeners.add(listener);
            return () -> listeners.remove(listener);
        }

        void push(Map<PeerId, Integer> activity) {
            for (var l : listeners) l.accept(activity);
        }
    }
}
