package com.tscan.server.detect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Tunable thresholds for stage A and the crowd penalty. A run works on its own
 * {@link #copy()} so edits made while a run is active do not leak into it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionParameters {
    public double thresh = 80;
    public boolean dynamicThresh = false;
    public double minArea = 6;
    public double maxArea = 600;
    public double sharpness = 1.2;
    public double maxSharpness = 5.0;
    public double contrast = 15;
    public int edgeMargin = 10;
    public boolean killFlat = true;
    // Only part of the cache key, no detection rule reads it
    public boolean killHist = true;
    public boolean killDipole = true;
    public boolean killNoRise = false;
    public double minRise = 0;
    public boolean autoCrop = true;
    public boolean autoClearCache = false;
    public String modelPath = "";

    public double crowdHighScore = 0.85;
    public int crowdHighCount = 10;
    public double crowdHighPenalty = 0.50;

    public DetectionParameters() {
    }

    public DetectionParameters copy() {
        DetectionParameters p = new DetectionParameters();
        p.thresh = thresh;
        p.dynamicThresh = dynamicThresh;
        p.minArea = minArea;
        p.maxArea = maxArea;
        p.sharpness = sharpness;
        p.maxSharpness = maxSharpness;
        p.contrast = contrast;
        p.edgeMargin = edgeMargin;
        p.killFlat = killFlat;
        p.killHist = killHist;
        p.killDipole = killDipole;
        p.killNoRise = killNoRise;
        p.minRise = minRise;
        p.autoCrop = autoCrop;
        p.autoClearCache = autoClearCache;
        p.modelPath = modelPath;
        p.crowdHighScore = crowdHighScore;
        p.crowdHighCount = crowdHighCount;
        p.crowdHighPenalty = crowdHighPenalty;
        return p;
    }
}
