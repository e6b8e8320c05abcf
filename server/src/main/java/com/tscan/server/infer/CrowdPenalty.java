package com.tscan.server.infer;

import com.tscan.server.detect.Candidate;

import java.util.List;

/**
 * Suppresses clusters of confident detections in one image (satellite trails,
 * bad columns). When more than {@code highCount} scored candidates reach
 * {@code highScore}, each of them loses {@code penalty}, floored at zero.
 * Candidates without an AI score are never touched.
 */
public class CrowdPenalty {

    private final double highScore;
    private final int highCount;
    private final double penalty;

    public CrowdPenalty(double highScore, int highCount, double penalty) {
        this.highScore = highScore;
        this.highCount = highCount;
        this.penalty = penalty;
    }

    /**
     * @return number of candidates penalized
     */
    public int apply(List<Candidate> candidates) {
        int high = 0;
        for (Candidate c : candidates) {
            if (c.hasAiScore() && c.getAiScore() >= highScore) {
                high++;
            }
        }
        if (high <= highCount) {
            return 0;
        }
        for (Candidate c : candidates) {
            if (c.hasAiScore() && c.getAiScore() >= highScore) {
                c.setAiScore(Math.max(0.0, c.getAiScore() - penalty));
            }
        }
        return high;
    }
}
