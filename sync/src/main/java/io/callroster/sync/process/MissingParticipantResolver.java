package io.callroster.sync.process;

import io.callroster.core.Participant;
import io.callroster.core.ParticipantOrdering;
import io.callroster.sync.SyncConfig;
import io.callroster.sync.net.CallNetwork;
import io.callroster.sync.net.ParticipantsPage;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backfills participants that are heard (by media source id) but not yet in the roster.
 * <p>
 * Semantics:
 *  - ssrcs already in the roster or already waiting are ignored,
 *  - at most one backfill fetch is outstanding, and only while no other roster
 *    fetch holds the shared {@link FetchGate},
 *  - fetched participants are merged in; entries already known win,
 *  - requested ssrcs leave the missing set whether or not the fetch succeeded
 *    (a failed id is requested again on the next activity report).
 */
public final class MissingParticipantResolver {
    private static final Logger log = Logger.getLogger(MissingParticipantResolver.class.getName());

    private final long callId;
    private final RosterStore store;
    private final FetchGate gate;
    private final CallNetwork network;
    private final SyncConfig config;
    private final Executor queue;
    private final Runnable onFetchSlotFreed;

    private final Set<Long> missing = new LinkedHashSet<>();
    private InFlightRequest inFlight;
    private boolean closed;

    public MissingParticipantResolver(
            long callId,
            RosterStore store,
            FetchGate gate,
            CallNetwork network,
            SyncConfig config,
            Executor queue,
            Runnable onFetchSlotFreed
    ) {
        this.callId = callId;
        this.store = Objects.requireNonNull(store, "store");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.network = Objects.requireNonNull(network, "network");
        this.config = Objects.requireNonNull(config, "config");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.onFetchSlotFreed = Objects.requireNonNull(onFetchSlotFreed, "onFetchSlotFreed");
    }

    /** ssrcs waiting to be fetched or currently being fetched. */
    public Set<Long> missing() { return Set.copyOf(missing); }

    public boolean isLoading() { return inFlight != null; }

    public void ensureHave(Set<Long> ssrcs) {
        if (closed || ssrcs.isEmpty()) {
            return;
        }
        Set<Long> known = new HashSet<>();
        for (Participant p : store.state().participants()) {
            if (p.ssrc() != null) {
                known.add(p.ssrc());
            }
        }
        boolean added = false;
        for (Long ssrc : ssrcs) {
            if (ssrc != null && !known.contains(ssrc)) {
                added |= missing.add(ssrc);
            }
        }
        if (added) {
            loadMissing();
        }
    }

    /** Start a backfill fetch if anything is missing and the fetch slot is free. */
    public void loadMissing() {
        if (closed || missing.isEmpty() || !gate.tryAcquire()) {
            return;
        }
        Set<Long> batch = new LinkedHashSet<>();
        for (Long ssrc : missing) {
            if (batch.size() == config.missingFetchLimit()) break;
            batch.add(ssrc);
        }

        InFlightRequest request = new InFlightRequest();
        inFlight = request;
        log.fine(() -> "call " + callId + ": fetching " + batch.size() + " missing participants");
        CompletableFuture<ParticipantsPage> f = network.fetchParticipants(
                callId, "", batch, config.missingFetchLimit(), true);
        request.bind(f);
        f.whenCompleteAsync((page, err) -> {
            if (request.isCancelled()) {
                return;
            }
            onLoaded(batch, page, err);
        }, queue);
    }

    private void onLoaded(Set<Long> batch, ParticipantsPage page, Throwable err) {
        inFlight = null;
        gate.release();
        missing.removeAll(batch);

        if (err != null) {
            log.log(Level.WARNING, "call " + callId + ": missing participants fetch failed", err);
        } else {
            store.updateState(s -> {
                List<Participant> merged = ParticipantOrdering.mergeAndSort(
                        s.participants(), page.participants(), s.sortAscending());
                return s.withRoster(merged, Math.max(s.totalCount(), page.totalCount()), s.version());
            });
        }
        onFetchSlotFreed.run();
    }

    public void close() {
        closed = true;
        missing.clear();
        if (inFlight != null) {
            inFlight.cancel();
            inFlight = null;
        }
    }
}
