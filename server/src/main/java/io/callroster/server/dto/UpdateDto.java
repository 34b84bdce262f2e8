package io.callroster.server.dto;

import java.util.List;

/**
 * One pushed or returned update.
 * <p>
 * type "state":    version + participants (a roster delta), optionally
 *                  removePendingMuteStates.
 * type "settings": terminated, defaultMuted, canChangeDefaultMuted, title,
 *                  recordingStartTimestamp.
 * <p>
 * callId is optional on pushes (the URL names the call) and set on mutation
 * responses, which may carry updates for other calls.
 */
public class UpdateDto {
    public String type;
    public Long callId;

    public int version;
    public List<ParticipantDto> participants;
    public List<Long> removePendingMuteStates;   // peers whose pending mute this delta confirms

    public boolean terminated;
    public boolean defaultMuted;
    public boolean canChangeDefaultMuted;
    public String title;
    public Integer recordingStartTimestamp;
}
