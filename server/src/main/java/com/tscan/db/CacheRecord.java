package com.tscan.db;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persisted result of one group. candidates_count, has_ai and max_ai are derived
 * from the candidate list when the record is built.
 */
public class CacheRecord {

    public static final String STATUS_UNSEEN = "unseen";

    private final String status;
    private final List<Candidate> candidates;
    private final CropRect cropRect;
    private final String paramsHash;
    private final long timestamp;
    private final int candidatesCount;
    private final int hasAi;
    private final double maxAi;

    public CacheRecord(String status, List<Candidate> candidates, CropRect cropRect, String paramsHash,
            long timestamp) {
        this.status = status != null ? status : STATUS_UNSEEN;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.cropRect = cropRect;
        this.paramsHash = paramsHash != null ? paramsHash : "";
        this.timestamp = timestamp;
        this.candidatesCount = candidates.size();

        int ai = 0;
        double max = 0.0;
        for (Candidate c : candidates) {
            if (c.hasAiScore()) {
                ai = 1;
                max = Math.max(max, c.getAiScore());
            }
        }
        this.hasAi = ai;
        this.maxAi = max;
    }

    public CacheRecord withStatus(String newStatus, long newTimestamp) {
        return new CacheRecord(newStatus, candidates, cropRect, paramsHash, newTimestamp);
    }

    public CacheRecord withCropRect(CropRect rect) {
        return new CacheRecord(status, candidates, rect, paramsHash, timestamp);
    }

    /**
     * Copy whose candidates can be modified without touching this record.
     */
    public CacheRecord deepCopy() {
        List<Candidate> copies = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            copies.add(c.copy());
        }
        return new CacheRecord(status, copies, cropRect, paramsHash, timestamp);
    }

    /**
     * True when the record already holds scored results for the given
     * parameters, so the group does not need recomputing.
     */
    public boolean isAuthoritativeFor(String currentHash) {
        return hasAi == 1 && candidatesCount > 0 && paramsHash.equals(currentHash);
    }

    public String getStatus() {
        return status;
    }

    public List<Candidate> getCandidates() {
        return candidates;
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

    @Override
    public String toString() {
        return "CacheRecord{status=" + status + ", count=" + candidatesCount + ", hasAi=" + hasAi
                + ", maxAi=" + maxAi + ", hash=" + paramsHash + "}";
    }
}
