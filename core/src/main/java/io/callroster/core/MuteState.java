package io.callroster.core;

/**
 * Mute flags of a participant.
 * <p>
 * A participant without a MuteState is unmuted and not muted by the viewer.
 *
 * @param canUnmute  the participant may unmute themselves
 * @param mutedByYou the viewer muted this participant locally
 */
public record MuteState(boolean canUnmute, boolean mutedByYou) {}
