// file: src/main/java/io/callroster/core/PeerId.java
package io.callroster.core;

/**
 * Opaque, stable identifier of a call member.
 * <p>
 * The core never holds peer objects, only these ids; anything richer is looked
 * up in the {@link PeerDirectory} at the point of use.
 * <p>
 * Ordering is by the numeric value and is the final tie-break of
 * {@link ParticipantOrdering}, so it must stay total and stable.
 */
public record PeerId(long value) implements Comparable<PeerId> {

    public static PeerId of(long value) { return new PeerId(value); }

    @Override
    public int compareTo(PeerId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() { return Long.toString(value); }
}
