package com.tscan.server.infer;

import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;

import java.util.List;

@FunctionalInterface
public interface GroupScoredListener {

    /**
     * Called once per group, after every candidate it contributed has a score
     * and the crowd penalty has been applied.
     */
    void onGroupScored(String groupName, List<Candidate> candidates, CropRect cropRect);
}
