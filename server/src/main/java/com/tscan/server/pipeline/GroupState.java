package com.tscan.server.pipeline;

public enum GroupState {
    QUEUED,
    EXTRACTING,
    SCORING,
    MERGING,
    PERSISTED,
    CACHED,
    SKIPPED,
    FAILED
}
