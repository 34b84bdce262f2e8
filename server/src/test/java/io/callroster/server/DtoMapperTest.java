package io.callroster.server;

import io.callroster.core.MuteState;
import io.callroster.core.ParticipantsState;
import io.callroster.core.PeerId;
import io.callroster.core.PeerRecord;
import io.callroster.core.update.CallSettingsUpdate;
import io.callroster.core.update.ParticipantUpdate;
import io.callroster.core.update.StateUpdate;
import io.callroster.core.update.Update;
import io.callroster.server.dto.ParticipantDto;
import io.callroster.server.dto.ParticipantsPageDto;
import io.callroster.server.dto.UpdateDto;
import io.callroster.sync.peer.InMemoryPeerDirectory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire flags and shapes to domain types and back.
 */
class DtoMapperTest {

    @Test
    void mute_flags_map_to_mute_state() {
        assertNull(DtoMapper.muteState(false, true, false));
        assertEquals(new MuteState(true, false), DtoMapper.muteState(true, true, false));
        assertEquals(new MuteState(false, true), DtoMapper.muteState(true, false, true));
        assertEquals(new MuteState(false, true), DtoMapper.muteState(false, true, true), "local-only mute");
    }

    @Test
    void participant_flags_select_membership_status() {
        ParticipantDto dto = participant(7, "Ann");
        assertEquals(ParticipantUpdate.Status.NONE, DtoMapper.participantUpdate(dto).status());
        dto.justJoined = true;
        assertEquals(ParticipantUpdate.Status.JOINED, DtoMapper.participantUpdate(dto).status());
        dto.left = true;
        assertEquals(ParticipantUpdate.Status.LEFT, DtoMapper.participantUpdate(dto).status());
        dto.min = true;
        assertTrue(DtoMapper.participantUpdate(dto).isMin());
    }

    @Test
    void state_and_settings_updates_are_decoded() {
        var state = new UpdateDto();
        state.type = "state";
        state.version = 12;
        state.participants = List.of(participant(7, "Ann"));
        var settings = new UpdateDto();
        settings.type = "settings";
        settings.defaultMuted = true;
        settings.title = "retro";
        settings.terminated = true;

        StateUpdate su = (StateUpdate) DtoMapper.update(state);
        CallSettingsUpdate cs = (CallSettingsUpdate) DtoMapper.update(settings);

        assertEquals(12, su.version());
        assertEquals(PeerId.of(7), su.participantUpdates().get(0).peerId());
        assertTrue(su.removePendingMuteStates().isEmpty());
        assertTrue(cs.isTerminated());
        assertTrue(cs.defaultParticipantsAreMuted().isMuted());
        assertEquals("retro", cs.title());
    }

    @Test
    void state_update_carries_confirmed_pending_mutes() {
        var dto = new UpdateDto();
        dto.type = "state";
        dto.version = 6;
        dto.participants = List.of();
        dto.removePendingMuteStates = List.of(7L, 8L);

        StateUpdate su = (StateUpdate) DtoMapper.update(dto);

        assertEquals(Set.of(PeerId.of(7), PeerId.of(8)), su.removePendingMuteStates());
    }

    @Test
    void first_page_carries_creator_flag_and_admins() {
        var dto = new ParticipantsPageDto();
        dto.participants = List.of(participant(1, "a"));
        dto.isCreator = true;
        dto.adminIds = List.of(3L);

        var page = DtoMapper.page(dto);
        var later = DtoMapper.page(new ParticipantsPageDto());

        assertTrue(page.isCreator());
        assertEquals(Set.of(PeerId.of(3)), page.adminIds());
        assertFalse(later.isCreator());
        assertTrue(later.adminIds().isEmpty());
    }

    @Test
    void malformed_updates_are_rejected() {
        var noType = new UpdateDto();
        var badType = new UpdateDto();
        badType.type = "mystery";
        var noPeer = new UpdateDto();
        noPeer.type = "state";
        noPeer.participants = List.of(new ParticipantDto());

        assertThrows(IllegalArgumentException.class, () -> DtoMapper.update(noType));
        assertThrows(IllegalArgumentException.class, () -> DtoMapper.update(badType));
        assertThrows(IllegalArgumentException.class, () -> DtoMapper.update(noPeer));
    }

    @Test
    void updates_for_other_calls_are_filtered_out() {
        var mine = new UpdateDto();
        mine.type = "state";
        mine.callId = 42L;
        var other = new UpdateDto();
        other.type = "state";
        other.callId = 43L;
        var unscoped = new UpdateDto();
        unscoped.type = "settings";

        List<Update> out = DtoMapper.updatesFor(42L, List.of(mine, other, unscoped));

        assertEquals(2, out.size());
    }

    @Test
    void empty_next_offset_means_no_more_pages() {
        var dto = new ParticipantsPageDto();
        dto.participants = List.of(participant(1, "a"), participant(2, "b"));
        dto.nextOffset = "";
        dto.totalCount = 2;
        dto.version = 4;

        var page = DtoMapper.page(dto);

        assertNull(page.nextOffset());
        assertEquals(2, page.participants().size());
        assertEquals(4, page.version());
    }

    @Test
    void edit_request_sends_muted_only_for_real_mutes() {
        PeerId me = PeerId.of(1);
        PeerId other = PeerId.of(2);

        assertTrue(DtoMapper.editRequest(me, me, new MuteState(true, false), null, null).muted, "self mute");
        assertFalse(DtoMapper.editRequest(me, other, new MuteState(true, false), null, null).muted,
                "unmutable-by-them mute of someone else is not forced");
        assertTrue(DtoMapper.editRequest(me, other, new MuteState(false, false), null, null).muted, "forced");
        assertTrue(DtoMapper.editRequest(me, other, new MuteState(false, true), null, null).muted, "local");
        assertFalse(DtoMapper.editRequest(me, other, null, null, null).muted);

        var withVolume = DtoMapper.editRequest(me, other, null, 0, true);
        assertNull(withVolume.volume, "non-positive volume is not sent");
        assertEquals(Boolean.TRUE, withVolume.raiseHand);
    }

    @Test
    void roster_response_resolves_display_names_per_access() {
        var peers = new InMemoryPeerDirectory();
        peers.put(new PeerRecord(PeerId.of(7), "Ann"));
        var p7 = DtoMapper.participant(participant(7, "ignored"));
        var p8 = DtoMapper.participant(participant(8, "ignored")).withMute(new MuteState(false, true), 50);
        var state = ParticipantsState.fromFetch(List.of(p7, p8), "next", false, 10, 3);

        var dto = DtoMapper.roster(42L, state, peers, false);

        assertEquals(3, dto.version);
        assertEquals(10, dto.totalCount);
        assertEquals("next", dto.nextFetchOffset);
        var ann = dto.participants.stream().filter(e -> e.peerId == 7).findFirst().orElseThrow();
        var unknown = dto.participants.stream().filter(e -> e.peerId == 8).findFirst().orElseThrow();
        assertEquals("Ann", ann.displayName);
        assertFalse(ann.muted);
        assertNull(unknown.displayName);
        assertTrue(unknown.muted);
        assertTrue(unknown.mutedByYou);
        assertFalse(unknown.canSelfUnmute);
        assertEquals(50, unknown.volume);
    }

    static ParticipantDto participant(long id, String name) {
        var dto = new ParticipantDto();
        dto.peerId = id;
        dto.displayName = name;
        dto.ssrc = id * 10;
        dto.joinTimestamp = 1000 + (int) id;
        return dto;
    }
}
