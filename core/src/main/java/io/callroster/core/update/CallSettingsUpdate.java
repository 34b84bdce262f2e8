package io.callroster.core.update;

import io.callroster.core.DefaultParticipantsAreMuted;

import java.util.Objects;

/**
 * Call-level settings pushed by the server. Applied as soon as it arrives; it
 * does not take part in delta versioning.
 */
public record CallSettingsUpdate(
        boolean isTerminated,
        DefaultParticipantsAreMuted defaultParticipantsAreMuted,
        String title,
        Integer recordingStartTimestamp
) implements Update {
    public CallSettingsUpdate {
        Objects.requireNonNull(defaultParticipantsAreMuted, "defaultParticipantsAreMuted");
    }
}
