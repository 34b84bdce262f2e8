// file: src/main/java/io/callroster/server/DtoMapper.java
package io.callroster.server;

import io.callroster.core.DefaultParticipantsAreMuted;
import io.callroster.core.MuteState;
import io.callroster.core.Participant;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerDirectory;
import io.callroster.core.PeerId;
import io.callroster.core.PeerRecord;
import io.callroster.core.update.CallSettingsUpdate;
import io.callroster.core.update.ParticipantUpdate;
import io.callroster.core.update.StateUpdate;
import io.callroster.core.update.Update;
import io.callroster.server.dto.EditParticipantRequest;
import io.callroster.server.dto.ParticipantDto;
import io.callroster.server.dto.ParticipantsPageDto;
import io.callroster.server.dto.RosterResponse;
import io.callroster.server.dto.UpdateDto;
import io.callroster.sync.net.ParticipantsPage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Conversions between gateway/HTTP DTOs and domain types.
 * <p>
 * Malformed input (missing peer id, unknown update type) is reported as
 * {@link IllegalArgumentException}, which the HTTP layer maps to 400.
 */
public final class DtoMapper {

    private DtoMapper() {
        // utility
    }

    // ---------- mute flags ----------

    /**
     * Flags to domain mute state:
     *  - muted:             {canUnmute: canSelfUnmute, mutedByYou}
     *  - only mutedByYou:   {canUnmute: false, mutedByYou: true}
     *  - neither:           null (unmuted)
     */
    public static MuteState muteState(boolean muted, boolean canSelfUnmute, boolean mutedByYou) {
        if (muted) {
            return new MuteState(canSelfUnmute, mutedByYou);
        } else if (mutedByYou) {
            return new MuteState(false, true);
        }
        return null;
    }

    // ---------- gateway -> domain ----------

    public static PeerRecord peerRecord(ParticipantDto dto) {
        return new PeerRecord(peerId(dto), dto.displayName);
    }

    public static Participant participant(ParticipantDto dto) {
        return new Participant(
                peerId(dto),
                dto.ssrc,
                dto.jsonParams,
                dto.joinTimestamp,
                dto.raiseHandRating,
                dto.activityTimestamp,
                null,
                muteState(dto.muted, dto.canSelfUnmute, dto.mutedByYou),
                dto.volume,
                dto.about
        );
    }

    public static ParticipantUpdate participantUpdate(ParticipantDto dto) {
        ParticipantUpdate.Status status;
        if (dto.left) {
            status = ParticipantUpdate.Status.LEFT;
        } else if (dto.justJoined) {
            status = ParticipantUpdate.Status.JOINED;
        } else {
            status = ParticipantUpdate.Status.NONE;
        }
        return new ParticipantUpdate(
                peerId(dto),
                dto.ssrc,
                dto.jsonParams,
                dto.joinTimestamp,
                dto.activityTimestamp,
                dto.raiseHandRating,
                muteState(dto.muted, dto.canSelfUnmute, dto.mutedByYou),
                status,
                dto.volume,
                dto.about,
                dto.min
        );
    }

    public static ParticipantsPage page(ParticipantsPageDto dto) {
        List<Participant> participants = new ArrayList<>();
        if (dto.participants != null) {
            for (ParticipantDto p : dto.participants) {
                participants.add(participant(p));
            }
        }
        String next = dto.nextOffset == null || dto.nextOffset.isEmpty() ? null : dto.nextOffset;
        return new ParticipantsPage(participants, next, dto.totalCount, dto.version, dto.sortAscending,
                dto.isCreator, peerIds(dto.adminIds));
    }

    public static Update update(UpdateDto dto) {
        if (dto.type == null) {
            throw new IllegalArgumentException("update type is required");
        }
        return switch (dto.type) {
            case "state" -> {
                List<ParticipantUpdate> ups = new ArrayList<>();
                if (dto.participants != null) {
                    for (ParticipantDto p : dto.participants) {
                        ups.add(participantUpdate(p));
                    }
                }
                yield new StateUpdate(ups, dto.version, peerIds(dto.removePendingMuteStates));
            }
            case "settings" -> new CallSettingsUpdate(
                    dto.terminated,
                    new DefaultParticipantsAreMuted(dto.defaultMuted, dto.canChangeDefaultMuted),
                    dto.title,
                    dto.recordingStartTimestamp
            );
            default -> throw new IllegalArgumentException("unknown update type: " + dto.type);
        };
    }

    /** Updates that belong to {@code callId}: those without a call id or with a matching one. */
    public static List<Update> updatesFor(long callId, List<UpdateDto> dtos) {
        List<Update> out = new ArrayList<>();
        if (dtos == null) {
            return out;
        }
        for (UpdateDto dto : dtos) {
            if (dto.callId == null || dto.callId == callId) {
                out.add(update(dto));
            }
        }
        return out;
    }

    /** Peer records carried by the participants of these updates. */
    public static List<PeerRecord> peerRecords(List<UpdateDto> dtos) {
        List<PeerRecord> out = new ArrayList<>();
        if (dtos == null) {
            return out;
        }
        for (UpdateDto dto : dtos) {
            if (dto.participants == null) continue;
            for (ParticipantDto p : dto.participants) {
                if (!p.left) {
                    out.add(peerRecord(p));
                }
            }
        }
        return out;
    }

    // ---------- domain -> gateway ----------

    /**
     * Edit request for one participant. The muted flag is only sent when the
     * change actually mutes: the viewer themselves, a forced mute, or a
     * local-only mute.
     */
    public static EditParticipantRequest editRequest(
            PeerId viewer, PeerId target, MuteState muteState, Integer volume, Boolean raiseHand) {
        var req = new EditParticipantRequest();
        if (muteState != null) {
            req.muted = !muteState.canUnmute() || target.equals(viewer) || muteState.mutedByYou();
        } else {
            req.muted = false;
        }
        if (volume != null && volume > 0) {
            req.volume = volume;
        }
        req.raiseHand = raiseHand;
        return req;
    }

    // ---------- domain -> HTTP ----------

    public static RosterResponse roster(long callId, ParticipantsState state, PeerDirectory peers, boolean terminated) {
        var dto = new RosterResponse();
        dto.callId = callId;
        dto.version = state.version();
        dto.totalCount = state.totalCount();
        dto.nextFetchOffset = state.nextFetchOffset();
        dto.title = state.title();
        dto.recordingStartTimestamp = state.recordingStartTimestamp();
        dto.defaultMuted = state.defaultParticipantsAreMuted().isMuted();
        dto.terminated = terminated;
        dto.participants = new ArrayList<>(state.participants().size());
        for (Participant p : state.participants()) {
            var e = new RosterResponse.Entry();
            e.peerId = p.peerId().value();
            e.displayName = peers.find(p.peerId()).map(PeerRecord::displayName).orElse(null);
            e.ssrc = p.ssrc();
            e.joinTimestamp = p.joinTimestamp();
            e.activityTimestamp = p.activityTimestamp();
            e.activityRank = p.activityRank();
            e.raiseHandRating = p.raiseHandRating();
            MuteState m = p.muteState();
            e.muted = m != null;
            e.canSelfUnmute = m == null || m.canUnmute();
            e.mutedByYou = m != null && m.mutedByYou();
            e.volume = p.volume();
            e.about = p.about();
            dto.participants.add(e);
        }
        return dto;
    }

    public static Set<PeerId> peerIds(List<Long> ids) {
        Set<PeerId> out = new HashSet<>();
        if (ids == null) {
            return out;
        }
        for (Long id : ids) {
            if (id == null) {
                throw new IllegalArgumentException("peer id must not be null");
            }
            out.add(PeerId.of(id));
        }
        return out;
    }

    private static PeerId peerId(ParticipantDto dto) {
        if (dto.peerId == null) {
            throw new IllegalArgumentException("participant peerId is required");
        }
        return PeerId.of(dto.peerId);
    }
}
