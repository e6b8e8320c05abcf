package com.tscan.server.service;

import com.tscan.server.pipeline.GroupState;

import java.util.EnumMap;
import java.util.Map;

public class ScanStatus {
    public boolean running;
    public String directory;
    public int processed;
    public int total;
    public String currentItem;
    public int pendingWrites;
    public Map<GroupState, Integer> groupStates = new EnumMap<>(GroupState.class);
    public int incompleteGroups;

    // Last finished run
    public String paramsHash;
    public int computed;
    public int cached;
    public int skipped;
    public int failed;
    public int classifierCalls;
    public boolean stopped;
    public long elapsedMs;
    public String error;
}
