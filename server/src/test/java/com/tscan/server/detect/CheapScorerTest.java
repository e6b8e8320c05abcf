package com.tscan.server.detect;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CheapScorerTest {

    private static Candidate candidate(double rise, double contrast, double sharp, double area) {
        Candidate c = new Candidate(0, 0);
        c.setRise(rise);
        c.setContrast(contrast);
        c.setSharp(sharp);
        c.setArea(area);
        return c;
    }

    @Test
    public void testFewCandidatesUseRise() {
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            list.add(candidate(10 * i, 50, 2, 10));
        }
        new CheapScorer(new ProcessingConfig()).score(list);
        for (int i = 0; i < 5; i++) {
            assertEquals(10 * i, list.get(i).getCheapScore(), 1e-9);
        }
    }

    @Test
    public void testRobustZCombination() {
        List<Candidate> list = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            list.add(candidate(10 * i, 50, 2, 10));
        }
        new CheapScorer(new ProcessingConfig()).score(list);

        // rise median 35, MAD 15; the other features are constant
        double z = 25 / (1.4826 * 15);
        assertEquals(2.0 * z, list.get(5).getCheapScore(), 1e-9);
        assertEquals(-2.0 * z, list.get(0).getCheapScore(), 1e-9);
        for (int i = 1; i < 6; i++) {
            assertTrue(list.get(i).getCheapScore() > list.get(i - 1).getCheapScore());
        }
    }

    @Test
    public void testAreaOutlierIsPenalized() {
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            list.add(candidate(100, 50, 2, 10));
        }
        list.get(3).setArea(400);
        new CheapScorer(new ProcessingConfig()).score(list);
        assertTrue(list.get(3).getCheapScore() < list.get(0).getCheapScore());
    }

    @Test
    public void testZeroMadFallsBackToDifference() {
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            list.add(candidate(5, 0, 0, 0));
        }
        list.get(0).setRise(8);
        double[] z = CheapScorer.robustZ(list, Candidate::getRise);
        assertEquals(3.0, z[0], 1e-9);
        assertEquals(0.0, z[1], 1e-9);
    }

    @Test
    public void testRiseOnlyMode() {
        ProcessingConfig config = new ProcessingConfig();
        config.cheapMode = ProcessingConfig.CheapMode.RISE_ONLY;
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            list.add(candidate(i, 50, 2, 10));
        }
        new CheapScorer(config).score(list);
        assertEquals(7, list.get(7).getCheapScore(), 1e-9);
    }
}
