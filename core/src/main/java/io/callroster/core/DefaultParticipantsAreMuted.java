package io.callroster.core;

/**
 * Call-level "join muted" setting.
 *
 * @param isMuted   new participants join muted
 * @param canChange the viewer is allowed to toggle the setting
 */
public record DefaultParticipantsAreMuted(boolean isMuted, boolean canChange) {

    public static DefaultParticipantsAreMuted off() {
        return new DefaultParticipantsAreMuted(false, false);
    }

    public DefaultParticipantsAreMuted withMuted(boolean muted) {
        return new DefaultParticipantsAreMuted(muted, canChange);
    }
}
