package com.tscan.server.pipeline;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total, label) -> {
    };

    /**
     * @param processed groups finished so far, never decreasing within a run
     * @param total     groups in the run
     * @param label     what just finished
     */
    void onProgress(int processed, int total, String label);
}
