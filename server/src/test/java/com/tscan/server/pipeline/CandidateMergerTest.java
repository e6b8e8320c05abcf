package com.tscan.server.pipeline;

import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.Verdict;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateMergerTest {

    private static Candidate fresh(int x, int y, double ai) {
        Candidate c = new Candidate(x, y);
        c.setAiScore(ai);
        return c;
    }

    @Test
    public void testManualCandidateSurvivesReprocessing() {
        Candidate manual = Candidate.manual(50, 50, Verdict.REAL);
        manual.setId(7);
        List<Candidate> previous = List.of(manual);

        List<Candidate> merged = CandidateMerger.merge(List.of(fresh(120, 80, 0.9)), previous);

        assertEquals(2, merged.size());
        Candidate kept = merged.get(1);
        assertTrue(kept.isManual());
        assertEquals(50, kept.getX());
        assertEquals(Verdict.REAL, kept.getVerdict());
        assertEquals(7, kept.getId());
        assertEquals(0, merged.get(0).getId());
    }

    @Test
    public void testNearbyFreshCandidateInheritsVerdict() {
        Candidate old = new Candidate(50, 50);
        old.setVerdict(Verdict.BOGUS);
        old.setSaved(Boolean.FALSE);
        old.setId(3);

        List<Candidate> merged = CandidateMerger.merge(
                new ArrayList<>(List.of(fresh(10, 10, 0.2), fresh(51, 51, 0.8))), List.of(old));

        assertEquals(2, merged.size());
        Candidate match = merged.get(1);
        assertEquals(51, match.getX());
        assertEquals(Verdict.BOGUS, match.getVerdict());
        assertEquals(Boolean.FALSE, match.getSaved());
        assertEquals(0.8, match.getAiScore(), 1e-9);
        assertEquals(3, match.getId());
        assertEquals(0, merged.get(0).getId());
    }

    @Test
    public void testMatchRadiusIsFivePixels() {
        Candidate old = new Candidate(50, 50);
        old.setVerdict(Verdict.REAL);

        List<Candidate> atRadius = CandidateMerger.merge(List.of(fresh(55, 45, 0.5)), List.of(old));
        assertEquals(1, atRadius.size());
        assertEquals(Verdict.REAL, atRadius.get(0).getVerdict());
        assertEquals(Boolean.TRUE, atRadius.get(0).getSaved());

        List<Candidate> beyond = CandidateMerger.merge(List.of(fresh(56, 50, 0.5)), List.of(old));
        assertEquals(2, beyond.size());
        assertNull(beyond.get(0).getVerdict());
    }

    @Test
    public void testUnreviewedHistoryIsDropped() {
        Candidate old = new Candidate(200, 200);
        old.setAiScore(0.99);
        List<Candidate> merged = CandidateMerger.merge(List.of(fresh(10, 10, 0.1)), List.of(old));
        assertEquals(1, merged.size());
    }

    @Test
    public void testUnknownVerdictDoesNotCount() {
        Candidate old = new Candidate(10, 10);
        old.setVerdict(Verdict.UNKNOWN);
        List<Candidate> merged = CandidateMerger.merge(List.of(fresh(10, 10, 0.1)), List.of(old));
        assertEquals(1, merged.size());
        assertNull(merged.get(0).getVerdict());
    }

    @Test
    public void testIdsStayUniqueOnCollision() {
        Candidate manualA = Candidate.manual(300, 300, Verdict.REAL);
        manualA.setId(0);
        Candidate manualB = Candidate.manual(400, 400, null);
        manualB.setId(0);

        List<Candidate> merged = CandidateMerger.merge(
                List.of(fresh(10, 10, 0.1), fresh(20, 20, 0.2)), List.of(manualA, manualB));

        assertEquals(4, merged.size());
        Set<Integer> ids = new HashSet<>();
        for (Candidate c : merged) {
            assertTrue(ids.add(c.getId()), "duplicate id " + c.getId());
        }
        assertEquals(0, merged.get(2).getId());
    }

    @Test
    public void testNoHistory() {
        List<Candidate> merged = CandidateMerger.merge(List.of(fresh(1, 1, 0.1), fresh(30, 30, 0.2)), null);
        assertEquals(0, merged.get(0).getId());
        assertEquals(1, merged.get(1).getId());
    }
}
