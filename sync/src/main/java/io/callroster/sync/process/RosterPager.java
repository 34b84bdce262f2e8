package io.callroster.sync.process;

import io.callroster.core.ParticipantOrdering;
import io.callroster.core.ParticipantsState;
import io.callroster.sync.SyncConfig;
import io.callroster.sync.net.CallNetwork;
import io.callroster.sync.net.ParticipantsPage;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads further pages of a large roster, driven by the state's nextFetchOffset.
 * A load only starts for the token the state currently advertises.
 */
public final class RosterPager {
    private static final Logger log = Logger.getLogger(RosterPager.class.getName());

    private final long callId;
    private final RosterStore store;
    private final FetchGate gate;
    private final CallNetwork network;
    private final SyncConfig config;
    private final Executor queue;
    private final Runnable onFetchSlotFreed;

    private InFlightRequest inFlight;
    private boolean closed;

    public RosterPager(
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

    public boolean isLoading() { return inFlight != null; }

    public void loadMore(String token) {
        if (closed) {
            return;
        }
        ParticipantsState state = store.state();
        if (token == null || !token.equals(state.nextFetchOffset())) {
            log.warning("call " + callId + ": loadMore called with invalid token " + token
                    + " (expected " + state.nextFetchOffset() + ")");
            return;
        }
        if (!gate.tryAcquire()) {
            log.fine(() -> "call " + callId + ": loadMore ignored, a fetch is already outstanding");
            return;
        }

        InFlightRequest request = new InFlightRequest();
        inFlight = request;
        CompletableFuture<ParticipantsPage> f = network.fetchParticipants(
                callId, token, Set.of(), config.pageLimit(), state.sortAscending());
        request.bind(f);
        f.whenCompleteAsync((page, err) -> {
            if (request.isCancelled()) {
                return;
            }
            onLoaded(page, err);
        }, queue);
    }

    private void onLoaded(ParticipantsPage page, Throwable err) {
        inFlight = null;
        gate.release();
        if (err != null) {
            log.log(Level.WARNING, "call " + callId + ": loading next page failed", err);
        } else {
            store.updateState(s -> s.withRoster(
                    ParticipantOrdering.mergeAndSort(s.participants(), page.participants(), s.sortAscending()),
                    Math.max(s.totalCount(), page.totalCount()),
                    s.version()
            ).withNextFetchOffset(page.nextOffset()));
        }
        onFetchSlotFreed.run();
    }

    public void close() {
        closed = true;
        if (inFlight != null) {
            inFlight.cancel();
            inFlight = null;
        }
    }
}
