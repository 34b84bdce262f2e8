// file: src/main/java/io/callroster/core/ParticipantOrdering.java
package io.callroster.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Total order over participants, plus the merge primitive built on it.
 * <p>
 * Priority (first difference wins):
 *  1) activityRank:      present before absent; smaller first.
 *  2) activityTimestamp: present before absent; larger (more recent) first.
 *  3) raiseHandRating:   present before absent; larger first.
 *  4) joinTimestamp:     ascending or descending depending on the call setting.
 *  5) peerId:            ascending.
 * <p>
 * Step 5 makes the order total: two distinct participants never compare equal,
 * so sorting the same set always yields the same list.
 */
public final class ParticipantOrdering {

    private ParticipantOrdering() {
        // utility
    }

    public static Comparator<Participant> comparator(boolean sortAscending) {
        return (a, b) -> compare(a, b, sortAscending);
    }

    /**
     * Compare two participants.
     *
     * @return negative if {@code a} is displayed before {@code b}
     */
    public static int compare(Participant a, Participant b, boolean sortAscending) {
        Integer rankA = a.activityRank();
        Integer rankB = b.activityRank();
        if (rankA != null && rankB != null) {
            if (!rankA.equals(rankB)) return Integer.compare(rankA, rankB);
        } else if (rankA != null) {
            return -1;
        } else if (rankB != null) {
            return 1;
        }

        Double activeA = a.activityTimestamp();
        Double activeB = b.activityTimestamp();
        if (activeA != null && activeB != null) {
            if (!activeA.equals(activeB)) return Double.compare(activeB, activeA);
        } else if (activeA != null) {
            return -1;
        } else if (activeB != null) {
            return 1;
        }

        Long handA = a.raiseHandRating();
        Long handB = b.raiseHandRating();
        if (handA != null && handB != null) {
            if (!handA.equals(handB)) return Long.compare(handB, handA);
        } else if (handA != null) {
            return -1;
        } else if (handB != null) {
            return 1;
        }

        if (a.joinTimestamp() != b.joinTimestamp()) {
            return sortAscending
                    ? Integer.compare(a.joinTimestamp(), b.joinTimestamp())
                    : Integer.compare(b.joinTimestamp(), a.joinTimestamp());
        }

        return a.peerId().compareTo(b.peerId());
    }

    /** Return a new sorted copy of {@code participants}. */
    public static List<Participant> sorted(Collection<Participant> participants, boolean sortAscending) {
        List<Participant> out = new ArrayList<>(participants);
        out.sort(comparator(sortAscending));
        return out;
    }

    /**
     * Union {@code incoming} into {@code current} by peerId and re-sort.
     * <p>
     * Entries already in {@code current} win: incoming entries are only added,
     * never used to overwrite. Used by missing-participant backfill and
     * pagination, where the fetched page may be older than what deltas have
     * already told us.
     */
    public static List<Participant> mergeAndSort(
            List<Participant> current,
            List<Participant> incoming,
            boolean sortAscending
    ) {
        List<Participant> merged = new ArrayList<>(current.size() + incoming.size());
        Set<PeerId> known = new HashSet<>();
        for (Participant p : current) {
            if (known.add(p.peerId())) {
                merged.add(p);
            }
        }
        for (Participant p : incoming) {
            if (known.add(p.peerId())) {
                merged.add(p);
            }
        }
        merged.sort(comparator(sortAscending));
        return merged;
    }
}
