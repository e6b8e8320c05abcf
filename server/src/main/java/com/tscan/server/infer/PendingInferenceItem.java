package com.tscan.server.infer;

import com.tscan.server.detect.PatchTensor;

public class PendingInferenceItem {
    private final String groupName;
    private final int candidateIndex;
    private final PatchTensor patch;

    public PendingInferenceItem(String groupName, int candidateIndex, PatchTensor patch) {
        this.groupName = groupName;
        this.candidateIndex = candidateIndex;
        this.patch = patch;
    }

    public String getGroupName() {
        return groupName;
    }

    public int getCandidateIndex() {
        return candidateIndex;
    }

    public PatchTensor getPatch() {
        return patch;
    }
}
