package com.tscan.server.detect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fixed processing constants: top-K sizes, patch geometry, cheap score weights,
 * worker pool and writer tuning.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessingConfig {

    public enum CheapMode {
        ROBUST_Z,
        RISE_ONLY
    }

    public int topkCheap = 20;
    public int topkRise = 20;
    public int topkContrast = 20;
    public boolean topkUnion = true;

    public int inferChunk = 512;
    public int cropSize = 80;
    public int resizeHw = 224;

    public CheapMode cheapMode = CheapMode.ROBUST_Z;
    public double wRise = 2.0;
    public double wContrast = 1.0;
    public double wSharp = 0.5;
    public double wAreaPenalty = 0.3;

    public int numWorkers = 4;
    public int inFlightPerWorker = 2;

    public int commitEvery = 50;
    public long commitIntervalMs = 1000;
    public int hotCacheSize = 2048;

    public int maxInFlight() {
        return Math.max(1, numWorkers * inFlightPerWorker);
    }
}
