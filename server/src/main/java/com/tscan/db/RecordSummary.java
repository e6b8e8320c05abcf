package com.tscan.db;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tscan.server.detect.CropRect;

public class RecordSummary {
    private final String status;
    private final int candidatesCount;
    private final int hasAi;
    private final double maxAi;
    private final CropRect cropRect;
    private final String paramsHash;
    private final long timestamp;

    public RecordSummary(String status, int candidatesCount, int hasAi, double maxAi, CropRect cropRect,
            String paramsHash, long timestamp) {
        this.status = status;
        this.candidatesCount = candidatesCount;
        this.hasAi = hasAi;
        this.maxAi = maxAi;
        this.cropRect = cropRect;
        this.paramsHash = paramsHash != null ? paramsHash : "";
        this.timestamp = timestamp;
    }

    public boolean isAuthoritativeFor(String currentHash) {
        return hasAi == 1 && candidatesCount > 0 && paramsHash.equals(currentHash);
    }

    public String getStatus() {
        return status;
    }

    @JsonProperty("candidates_count")
    public int getCandidatesCount() {
        return candidatesCount;
    }

    @JsonProperty("has_ai")
    public int getHasAi() {
        return hasAi;
    }

    @JsonProperty("max_ai")
    public double getMaxAi() {
        return maxAi;
    }

    @JsonProperty("crop_rect")
    public CropRect getCropRect() {
        return cropRect;
    }

    @JsonProperty("params_hash")
    public String getParamsHash() {
        return paramsHash;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
