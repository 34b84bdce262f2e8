// file: src/main/java/io/callroster/sync/process/UpdateProcessor.java
package io.callroster.sync.process;

import io.callroster.core.OverlayState;
import io.callroster.core.Participant;
import io.callroster.core.ParticipantOrdering;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerDirectory;
import io.callroster.core.PeerId;
import io.callroster.core.update.ParticipantUpdate;
import io.callroster.core.update.StateUpdate;
import io.callroster.sync.MemberEvent;
import io.callroster.sync.SyncConfig;
import io.callroster.sync.net.CallNetwork;
import io.callroster.sync.net.ParticipantsPage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies versioned roster deltas in order and recovers from gaps.
 * <p>
 * Responsibilities:
 *  - buffer incoming deltas in a FIFO queue and apply at most one at a time,
 *  - classify each delta against the current version (stale / apply / gap),
 *  - on a gap, drop the queue and replace the roster with a fresh snapshot,
 *  - clear confirmed overlay entries whatever the classification.
 * <p>
 * Semantics for a delta with version v against current version c:
 *  - v &lt; c:     stale, payload discarded.
 *  - v &gt; c + 1: gap, resync from the server; nothing of this delta is applied.
 *  - otherwise:  applied; the state's version becomes v.
 * <p>
 * Must only be used from the call queue.
 */
public final class UpdateProcessor {
    private static final Logger log = Logger.getLogger(UpdateProcessor.class.getName());

    /** What the processor is doing right now. */
    public enum Phase { IDLE, PROCESSING_UPDATE, RESYNCING_FROM_SERVER }

    private final long callId;
    private final RosterStore store;
    private final FetchGate gate;
    private final CallNetwork network;
    private final PeerDirectory peers;
    private final SyncConfig config;
    private final Executor queue;
    private final Consumer<MemberEvent> memberEvents;
    private final Runnable onFetchSlotFreed;

    private final ArrayDeque<StateUpdate> pending = new ArrayDeque<>();
    private Phase phase = Phase.IDLE;
    private InFlightRequest resyncRequest;
    private boolean closed;

    public UpdateProcessor(
            long callId,
            RosterStore store,
            FetchGate gate,
            CallNetwork network,
            PeerDirectory peers,
            SyncConfig config,
            Executor queue,
            Consumer<MemberEvent> memberEvents,
            Runnable onFetchSlotFreed
    ) {
        this.callId = callId;
        this.store = Objects.requireNonNull(store, "store");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.network = Objects.requireNonNull(network, "network");
        this.peers = Objects.requireNonNull(peers, "peers");
        this.config = Objects.requireNonNull(config, "config");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.memberEvents = Objects.requireNonNull(memberEvents, "memberEvents");
        this.onFetchSlotFreed = Objects.requireNonNull(onFetchSlotFreed, "onFetchSlotFreed");
    }

    public Phase phase() { return phase; }

    public int pendingCount() { return pending.size(); }

    /** Queue deltas behind the ones already waiting and apply whatever can be applied now. */
    public void enqueue(List<StateUpdate> updates) {
        if (closed || updates.isEmpty()) {
            return;
        }
        pending.addAll(updates);
        drain();
    }

    private void drain() {
        while (phase == Phase.IDLE && !pending.isEmpty()) {
            StateUpdate next = pending.poll();
            phase = Phase.PROCESSING_UPDATE;
            try {
                process(next);
            } finally {
                if (phase == Phase.PROCESSING_UPDATE) {
                    phase = Phase.IDLE;
                }
            }
        }
    }

    private void process(StateUpdate update) {
        int current = store.state().version();
        int v = update.version();

        if (v < current) {
            log.fine(() -> "call " + callId + ": stale delta v" + v + " (at v" + current + ")");
            store.updateOverlay(o -> o.withoutAll(update.removePendingMuteStates()));
            return;
        }
        if (v > current + 1) {
            log.info(() -> "call " + callId + ": gap, got v" + v + " at v" + current + ", resyncing");
            store.updateOverlay(o -> o.withoutAll(update.removePendingMuteStates()));
            requestResync();
            return;
        }
        apply(update, v != current);
    }

    private void apply(StateUpdate update, boolean isVersionUpdate) {
        ParticipantsState state = store.state();
        Map<PeerId, Participant> byId = new LinkedHashMap<>();
        for (Participant p : state.participants()) {
            byId.put(p.peerId(), p);
        }
        int totalCount = state.totalCount();
        List<MemberEvent> events = new ArrayList<>();

        for (ParticipantUpdate pu : update.participantUpdates()) {
            PeerId id = pu.peerId();
            if (pu.status() == ParticipantUpdate.Status.LEFT) {
                if (byId.remove(id) != null) {
                    totalCount = Math.max(0, totalCount - 1);
                    events.add(new MemberEvent(id, false));
                } else if (isVersionUpdate) {
                    totalCount = Math.max(0, totalCount - 1);
                }
                continue;
            }

            if (!peers.contains(id)) {
                if (config.strictPeerResolution()) {
                    throw new IllegalStateException("call " + callId + ": delta v" + update.version()
                            + " names unknown peer " + id);
                }
                log.warning("call " + callId + ": skipping update for unknown peer " + id);
                continue;
            }

            Participant previous = byId.get(id);
            byId.put(id, pu.applyTo(previous));
            if (previous == null && pu.status() == ParticipantUpdate.Status.JOINED) {
                totalCount += 1;
                events.add(new MemberEvent(id, true));
            }
        }

        List<Participant> sorted = ParticipantOrdering.sorted(byId.values(), state.sortAscending());
        totalCount = Math.max(totalCount, sorted.size());
        ParticipantsState next = state.withRoster(sorted, totalCount, update.version());
        OverlayState overlay = store.overlay().withoutAll(update.removePendingMuteStates());
        store.set(new InternalState(next, overlay));

        for (MemberEvent e : events) {
            memberEvents.accept(e);
        }
    }

    /**
     * Drop everything queued and replace the roster with a fresh first page.
     * Deltas arriving while the snapshot is in flight are kept and drained after it.
     * Deferred when another roster fetch holds the fetch slot.
     */
    public void requestResync() {
        dropPending();
        phase = Phase.RESYNCING_FROM_SERVER;
        if (!gate.tryAcquire()) {
            log.fine(() -> "call " + callId + ": resync deferred until the outstanding fetch completes");
            gate.deferResync();
            return;
        }
        startResync();
    }

    /**
     * Start a resync that was deferred while another fetch held the slot.
     *
     * @return true if a resync was started (the fetch slot is taken again)
     */
    public boolean resumeDeferredResync() {
        if (closed || gate.isLoading() || !gate.takeDeferredResync()) {
            return false;
        }
        gate.tryAcquire();
        startResync();
        return true;
    }

    private void startResync() {
        InFlightRequest request = new InFlightRequest();
        resyncRequest = request;
        CompletableFuture<ParticipantsPage> f = network.fetchParticipants(
                callId, "", Set.of(), config.pageLimit(), store.state().sortAscending());
        request.bind(f);
        f.whenCompleteAsync((page, err) -> {
            if (request.isCancelled()) {
                return;
            }
            onResyncResult(page, err);
        }, queue);
    }

    private void onResyncResult(ParticipantsPage page, Throwable err) {
        resyncRequest = null;
        gate.release();
        if (err != null) {
            log.log(Level.WARNING, "call " + callId + ": resync failed, waiting for the next delta", err);
            dropPending();
            phase = Phase.IDLE;
        } else {
            finishResync(page);
            log.info(() -> "call " + callId + ": resynced at v" + page.version()
                    + " with " + page.participants().size() + " participants");
            phase = Phase.IDLE;
            drain();
        }
        onFetchSlotFreed.run();
    }

    private void finishResync(ParticipantsPage page) {
        ParticipantsState local = store.state();
        Map<PeerId, Participant> localById = new HashMap<>();
        for (Participant p : local.participants()) {
            localById.put(p.peerId(), p);
        }

        List<Participant> carried = new ArrayList<>(page.participants().size());
        for (Participant p : page.participants()) {
            Participant known = localById.get(p.peerId());
            if (known != null) {
                p = p.withActivityRank(known.activityRank())
                        .withActivityTimestamp(maxOf(known.activityTimestamp(), p.activityTimestamp()));
            }
            carried.add(p);
        }

        ParticipantsState snapshot = ParticipantsState.fromFetch(
                carried, page.nextOffset(), page.sortAscending(), page.totalCount(), page.version()
        ).withSettingsOf(local);
        store.updateState(s -> snapshot);
    }

    /** Discard queued deltas; the overlay entries they confirm are released all the same. */
    private void dropPending() {
        Set<PeerId> confirmed = new HashSet<>();
        for (StateUpdate d : pending) {
            confirmed.addAll(d.removePendingMuteStates());
        }
        pending.clear();
        if (!confirmed.isEmpty()) {
            store.updateOverlay(o -> o.withoutAll(confirmed));
        }
    }

    private static Double maxOf(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.max(a, b);
    }

    /** Abandon the queue and any resync in flight. */
    public void close() {
        closed = true;
        pending.clear();
        if (resyncRequest != null) {
            resyncRequest.cancel();
            resyncRequest = null;
        }
    }
}
