package com.tscan.server.detect;

import java.util.List;

// patches.get(i) belongs to candidates.get(i)
public class StageAResult {
    private final String name;
    private final CropRect cropRect;
    private final List<Candidate> candidates;
    private final List<PatchTensor> patches;
    private final int rawCount;
    private final long elapsedMs;

    public StageAResult(String name, CropRect cropRect, List<Candidate> candidates, List<PatchTensor> patches,
            int rawCount, long elapsedMs) {
        if (candidates.size() != patches.size()) {
            throw new IllegalArgumentException("candidates and patches differ in length");
        }
        this.name = name;
        this.cropRect = cropRect;
        this.candidates = candidates;
        this.patches = patches;
        this.rawCount = rawCount;
        this.elapsedMs = elapsedMs;
    }

    public String getName() {
        return name;
    }

    public CropRect getCropRect() {
        return cropRect;
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public List<PatchTensor> getPatches() {
        return patches;
    }

    public int getRawCount() {
        return rawCount;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }
}
