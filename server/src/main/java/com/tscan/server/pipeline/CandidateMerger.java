package com.tscan.server.pipeline;

import com.tscan.server.detect.Candidate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Carries human work from a previous record into a freshly scored candidate
 * list. Identity is position: a historical manual or verdict-bearing entry
 * matches the first candidate within {@link #MERGE_RADIUS} pixels on both axes.
 * A match passes on its verdict and id; an unmatched entry is appended as is.
 * <p>
 * Two genuinely distinct transients closer than the radius are treated as one.
 */
public class CandidateMerger {

    public static final int MERGE_RADIUS = 5;

    public static List<Candidate> merge(List<Candidate> fresh, List<Candidate> previous) {
        List<Candidate> out = new ArrayList<>(fresh);
        Map<Candidate, Integer> wantedIds = new IdentityHashMap<>();

        if (previous != null) {
            for (Candidate old : previous) {
                if (!old.isHumanCurated()) {
                    continue;
                }
                Candidate match = null;
                for (Candidate c : out) {
                    if (c.isNear(old, MERGE_RADIUS)) {
                        match = c;
                        break;
                    }
                }
                if (match == null) {
                    Candidate kept = old.copy();
                    out.add(kept);
                    wantedIds.put(kept, old.getId());
                    continue;
                }
                if (old.hasVerdict()) {
                    match.setVerdict(old.getVerdict());
                    match.setSaved(old.getSaved() != null ? old.getSaved() : Boolean.TRUE);
                }
                wantedIds.putIfAbsent(match, old.getId());
            }
        }

        assignIds(out, wantedIds);
        return out;
    }

    /**
     * Entries carried over from history keep their id when it is free; every
     * other candidate gets the smallest unused id, in list order.
     */
    private static void assignIds(List<Candidate> candidates, Map<Candidate, Integer> wantedIds) {
        Set<Integer> used = new HashSet<>();
        List<Candidate> unassigned = new ArrayList<>();
        for (Candidate c : candidates) {
            Integer wanted = wantedIds.get(c);
            if (wanted != null && wanted >= 0 && used.add(wanted)) {
                c.setId(wanted);
            } else {
                unassigned.add(c);
            }
        }
        int next = 0;
        for (Candidate c : unassigned) {
            while (used.contains(next)) {
                next++;
            }
            c.setId(next);
            used.add(next);
        }
    }
}
