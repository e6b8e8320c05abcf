package com.tscan.server.detect;

import java.util.Arrays;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Fast pre-ranking of candidates before the classifier sees them.
 */
public class CheapScorer {

    static final int MIN_FOR_ROBUST_Z = 5;
    private static final double Z_CLIP = 5.0;
    private static final double MAD_SCALE = 1.4826;
    private static final double MAD_EPSILON = 1e-6;

    private final ProcessingConfig config;

    public CheapScorer(ProcessingConfig config) {
        this.config = config;
    }

    /**
     * Sets cheap_score on every candidate. With more than five candidates in
     * robust-z mode the score combines rise, contrast and sharpness z-scores and
     * penalizes area outliers; otherwise it is the raw rise.
     */
    public void score(List<Candidate> candidates) {
        if (config.cheapMode != ProcessingConfig.CheapMode.ROBUST_Z || candidates.size() <= MIN_FOR_ROBUST_Z) {
            for (Candidate c : candidates) {
                c.setCheapScore(c.getRise());
            }
            return;
        }

        double[] zRise = robustZ(candidates, Candidate::getRise);
        double[] zContrast = robustZ(candidates, Candidate::getContrast);
        double[] zSharp = robustZ(candidates, Candidate::getSharp);
        double[] zArea = robustZ(candidates, Candidate::getArea);

        for (int i = 0; i < candidates.size(); i++) {
            double s = config.wRise * clip(zRise[i])
                    + config.wContrast * clip(zContrast[i])
                    + config.wSharp * clip(zSharp[i])
                    - config.wAreaPenalty * Math.abs(zArea[i]);
            candidates.get(i).setCheapScore(s);
        }
    }

    static double[] robustZ(List<Candidate> candidates, ToDoubleFunction<Candidate> feature) {
        double[] values = new double[candidates.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = feature.applyAsDouble(candidates.get(i));
        }
        double med = median(values);
        double[] dev = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            dev[i] = Math.abs(values[i] - med);
        }
        double mad = median(dev);

        double[] z = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            z[i] = mad < MAD_EPSILON ? values[i] - med : (values[i] - med) / (MAD_SCALE * mad);
        }
        return z;
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n == 0) {
            return 0.0;
        }
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    private static double clip(double z) {
        return Math.max(-Z_CLIP, Math.min(Z_CLIP, z));
    }
}
