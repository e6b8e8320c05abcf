package com.tscan.server.infer;

import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;
import com.tscan.server.detect.PatchTensor;
import com.tscan.server.detect.StageAResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects patches from many stage A results and evaluates the classifier in
 * fixed-size chunks regardless of which group a patch came from. A group is
 * complete once all of its candidates are scored; completion is reported to the
 * {@link GroupScoredListener} independently of other groups.
 * <p>
 * Flushing runs on the thread that calls {@link #submit} or {@link #flush}. The
 * classifier is only ever invoked under this object's lock.
 */
public class InferenceBatcher {

    private static final Logger logger = LoggerFactory.getLogger(InferenceBatcher.class);

    private final PatchClassifier classifier;
    private final int chunkSize;
    private final CrowdPenalty crowdPenalty;
    private final GroupScoredListener listener;

    private final List<PendingInferenceItem> pending = new ArrayList<>();
    private final Map<String, PendingGroup> groups = new HashMap<>();

    private int classifierCalls = 0;
    private long scoredPatches = 0;

    private static class PendingGroup {
        final List<Candidate> candidates;
        final CropRect cropRect;
        int remaining;

        PendingGroup(List<Candidate> candidates, CropRect cropRect) {
            this.candidates = candidates;
            this.cropRect = cropRect;
            this.remaining = candidates.size();
        }
    }

    public InferenceBatcher(PatchClassifier classifier, int chunkSize, CrowdPenalty crowdPenalty,
            GroupScoredListener listener) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.classifier = classifier;
        this.chunkSize = chunkSize;
        this.crowdPenalty = crowdPenalty;
        this.listener = listener;
    }

    /**
     * Queues the patches of one group and flushes every full chunk. A group
     * without candidates completes immediately.
     */
    public synchronized void submit(StageAResult result) throws ClassifierException {
        String name = result.getName();
        if (groups.containsKey(name)) {
            throw new IllegalStateException("Group " + name + " is already awaiting scores");
        }
        if (result.getCandidates().isEmpty()) {
            listener.onGroupScored(name, new ArrayList<>(), result.getCropRect());
            return;
        }
        groups.put(name, new PendingGroup(result.getCandidates(), result.getCropRect()));
        List<PatchTensor> patches = result.getPatches();
        for (int i = 0; i < patches.size(); i++) {
            pending.add(new PendingInferenceItem(name, i, patches.get(i)));
        }
        flush(false);
    }

    /**
     * Evaluates every full chunk; with {@code force} also the remainder.
     */
    public synchronized void flush(boolean force) throws ClassifierException {
        while (pending.size() >= chunkSize || (force && !pending.isEmpty())) {
            int n = Math.min(chunkSize, pending.size());
            List<PendingInferenceItem> chunk = new ArrayList<>(pending.subList(0, n));
            pending.subList(0, n).clear();
            evaluate(chunk);
        }
    }

    private void evaluate(List<PendingInferenceItem> chunk) throws ClassifierException {
        List<PatchTensor> patches = new ArrayList<>(chunk.size());
        for (PendingInferenceItem item : chunk) {
            patches.add(item.getPatch());
        }

        double[] scores;
        try {
            scores = classifier.score(patches);
        } catch (RuntimeException e) {
            throw new ClassifierException("Classifier failed on a chunk of " + chunk.size(), e);
        }
        classifierCalls++;
        if (scores == null || scores.length != chunk.size()) {
            throw new ClassifierException("Classifier returned " + (scores == null ? "no" : scores.length)
                    + " scores for a chunk of " + chunk.size());
        }
        scoredPatches += chunk.size();
        logger.debug("Scored chunk of {} patches, {} still pending", chunk.size(), pending.size());

        Map<String, Integer> updatesByGroup = new LinkedHashMap<>();
        for (int i = 0; i < chunk.size(); i++) {
            PendingInferenceItem item = chunk.get(i);
            PendingGroup group = groups.get(item.getGroupName());
            group.candidates.get(item.getCandidateIndex()).setAiScore(scores[i]);
            updatesByGroup.merge(item.getGroupName(), 1, Integer::sum);
        }

        for (Map.Entry<String, Integer> e : updatesByGroup.entrySet()) {
            PendingGroup group = groups.get(e.getKey());
            group.remaining -= e.getValue();
            if (group.remaining <= 0) {
                groups.remove(e.getKey());
                complete(e.getKey(), group);
            }
        }
    }

    private void complete(String name, PendingGroup group) {
        List<Candidate> scored = new ArrayList<>(group.candidates.size());
        for (Candidate c : group.candidates) {
            if (c.hasAiScore()) {
                scored.add(c);
            }
        }
        int penalized = crowdPenalty.apply(scored);
        if (penalized > 0) {
            logger.info("Crowd penalty applied to {} candidates of {}", penalized, name);
        }
        listener.onGroupScored(name, scored, group.cropRect);
    }

    public synchronized int getPendingItemCount() {
        return pending.size();
    }

    public synchronized int getPendingGroupCount() {
        return groups.size();
    }

    public synchronized int getClassifierCalls() {
        return classifierCalls;
    }

    public synchronized long getScoredPatches() {
        return scoredPatches;
    }
}
