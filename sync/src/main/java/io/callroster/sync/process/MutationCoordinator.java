// file: src/main/java/io/callroster/sync/process/MutationCoordinator.java
package io.callroster.sync.process;

import io.callroster.core.DefaultParticipantsAreMuted;
import io.callroster.core.MuteState;
import io.callroster.core.OverlayState;
import io.callroster.core.Participant;
import io.callroster.core.PeerId;
import io.callroster.core.update.StateUpdate;
import io.callroster.core.update.Update;
import io.callroster.sync.net.CallNetwork;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues local mutations and keeps the optimistic overlay in step with them.
 * <p>
 * Responsibilities:
 *  - per-peer mute/volume changes: overlay entry while in flight, replaced
 *    (old request cancelled) by a newer change for the same peer,
 *  - raise/lower hand: no overlay, the server's delta is awaited,
 *  - call-level mutations (recording, default-muted, invite links): one
 *    replaceable request each.
 * <p>
 * Server responses are handed to {@code sink}, which routes them through the
 * normal update path. Must only be used from the call queue.
 */
public final class MutationCoordinator {
    private static final Logger log = Logger.getLogger(MutationCoordinator.class.getName());

    private final long callId;
    private final RosterStore store;
    private final CallNetwork network;
    private final Executor queue;
    private final Consumer<List<Update>> sink;

    private final Set<InFlightRequest> inFlight = new HashSet<>();
    private InFlightRequest recordingRequest;
    private InFlightRequest defaultMutedRequest;
    private InFlightRequest inviteLinksRequest;
    private boolean closed;

    public MutationCoordinator(
            long callId,
            RosterStore store,
            CallNetwork network,
            Executor queue,
            Consumer<List<Update>> sink
    ) {
        this.callId = callId;
        this.store = Objects.requireNonNull(store, "store");
        this.network = Objects.requireNonNull(network, "network");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /** Requests started and not yet completed or cancelled. */
    public int inFlightCount() { return inFlight.size(); }

    /**
     * Change mute state, volume or raised hand of {@code peerId}.
     *
     * @param muteState desired mute state, null = unmuted
     * @param volume    desired volume, null = unchanged
     * @param raiseHand null when the hand is not part of this change
     */
    public void updateMuteState(PeerId peerId, MuteState muteState, Integer volume, Boolean raiseHand) {
        Objects.requireNonNull(peerId, "peerId");
        if (closed) {
            return;
        }

        OverlayState.PendingMuteChange pending = store.overlay().get(peerId);
        if (pending != null) {
            if (Objects.equals(pending.state(), muteState)) {
                return;
            }
            pending.handle().cancel();
            store.updateOverlay(o -> o.without(peerId));
        }

        Optional<Participant> current = store.state().find(peerId);
        if (current.isPresent() && alreadyApplied(current.get(), muteState, volume, raiseHand)) {
            return;
        }

        InFlightRequest request = new InFlightRequest();
        if (raiseHand == null) {
            store.updateOverlay(o -> o.with(peerId, new OverlayState.PendingMuteChange(muteState, volume, request)));
        }

        track(request, () -> network.editParticipant(callId, peerId, muteState, volume, raiseHand), (updates, err) -> {
            if (err != null) {
                log.log(Level.FINE, "call " + callId + ": mute change for " + peerId + " failed, rolling back", err);
                store.updateOverlay(o -> o.without(peerId));
                return;
            }
            List<Update> confirmed = new ArrayList<>(updates.size());
            boolean sawState = false;
            for (Update u : updates) {
                if (u instanceof StateUpdate su) {
                    confirmed.add(su.confirming(peerId));
                    sawState = true;
                } else {
                    confirmed.add(u);
                }
            }
            if (!sawState) {
                store.updateOverlay(o -> o.without(peerId));
            }
            sink.accept(confirmed);
        });
    }

    private static boolean alreadyApplied(Participant p, MuteState muteState, Integer volume, Boolean raiseHand) {
        boolean handEqual = raiseHand == null || raiseHand == p.hasRaiseHand();
        return Objects.equals(p.muteState(), muteState) && Objects.equals(p.volume(), volume) && handEqual;
    }

    public void updateShouldBeRecording(boolean shouldBeRecording, String title) {
        if (closed) {
            return;
        }
        if (recordingRequest != null) {
            recordingRequest.cancel();
        }
        InFlightRequest request = new InFlightRequest();
        recordingRequest = request;
        track(request, () -> network.toggleRecording(callId, shouldBeRecording, title),
                resultTo("recording toggle"));
    }

    /** Optimistically flips the "join muted" setting, then asks the server to do the same. */
    public void updateDefaultParticipantsAreMuted(boolean isMuted) {
        if (closed) {
            return;
        }
        DefaultParticipantsAreMuted current = store.state().defaultParticipantsAreMuted();
        if (current.isMuted() == isMuted) {
            return;
        }
        store.updateState(s -> s.withDefaultParticipantsAreMuted(current.withMuted(isMuted)));

        if (defaultMutedRequest != null) {
            defaultMutedRequest.cancel();
        }
        InFlightRequest request = new InFlightRequest();
        defaultMutedRequest = request;
        track(request, () -> network.toggleDefaultMuted(callId, isMuted), resultTo("default-muted toggle"));
    }

    public void resetInviteLinks() {
        if (closed) {
            return;
        }
        if (inviteLinksRequest != null) {
            inviteLinksRequest.cancel();
        }
        InFlightRequest request = new InFlightRequest();
        inviteLinksRequest = request;
        track(request, () -> network.resetInviteLinks(callId), resultTo("invite link reset"));
    }

    private Completion resultTo(String what) {
        return (updates, err) -> {
            if (err != null) {
                log.log(Level.WARNING, "call " + callId + ": " + what + " failed", err);
                return;
            }
            sink.accept(updates);
        };
    }

    private void track(InFlightRequest request, Supplier<CompletableFuture<List<Update>>> call, Completion onDone) {
        inFlight.add(request);
        CompletableFuture<List<Update>> f;
        try {
            f = call.get();
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        request.bind(f);
        f.whenCompleteAsync((updates, err) -> {
            inFlight.remove(request);
            if (request.isCancelled()) {
                return;
            }
            onDone.complete(updates, err);
        }, queue);
    }

    /** Cancel every outstanding mutation; their results will be ignored. */
    public void close() {
        closed = true;
        for (InFlightRequest r : inFlight) {
            r.cancel();
        }
        inFlight.clear();
    }

    @FunctionalInterface
    private interface Completion {
        void complete(List<Update> updates, Throwable err);
    }
}
