package com.tscan.server.pipeline;

import com.tscan.db.CacheRecord;
import com.tscan.db.RecordStore;
import com.tscan.db.RecordSummary;
import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;
import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.detect.FeatureExtractor;
import com.tscan.server.detect.ProcessingConfig;
import com.tscan.server.detect.StageAResult;
import com.tscan.server.detect.TripletPaths;
import com.tscan.server.infer.ClassifierException;
import com.tscan.server.infer.CrowdPenalty;
import com.tscan.server.infer.InferenceBatcher;
import com.tscan.server.infer.PatchClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one pass over a set of triplet groups. Stage A runs on a fixed worker
 * pool with a bounded number of groups in flight; completed results are fed to
 * the inference batcher on the calling thread, which also merges and persists
 * each scored group. Groups whose stored record was produced with the current
 * parameter hash are answered from the store without any work.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final long POLL_MS = 200;

    private final PipelineContext ctx;
    private final FeatureExtractor extractor;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Map<String, GroupState> states = new ConcurrentHashMap<>();

    public PipelineOrchestrator(PipelineContext ctx) {
        this(ctx, new FeatureExtractor(ctx.getParams(), ctx.getConfig()));
    }

    public PipelineOrchestrator(PipelineContext ctx, FeatureExtractor extractor) {
        this.ctx = ctx;
        this.extractor = extractor;
    }

    /**
     * Stops scheduling new groups. A classifier call already running completes.
     */
    public void requestStop() {
        if (!stopRequested.getAndSet(true)) {
            logger.info("Stop requested");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public Map<String, GroupState> getGroupStates() {
        return new LinkedHashMap<>(states);
    }

    public RunSummary run(Map<String, TripletPaths> groups, ProgressListener progress) throws ClassifierException {
        long t0 = System.currentTimeMillis();
        DetectionParameters params = ctx.getParams();
        ProcessingConfig config = ctx.getConfig();
        PatchClassifier classifier = ctx.getClassifier();
        RecordStore store = ctx.getStore();

        String hash = ParamsHash.compute(params, config, classifier.getModelIdentity());
        classifier.verifyReady();

        if (params.autoClearCache) {
            logger.info("Clearing all cached records before the run");
            store.clearAll();
        }

        List<String> names = new ArrayList<>(groups.keySet());
        Collections.sort(names);
        RunSummary summary = new RunSummary(names.size(), hash);
        logger.info("Run started: {} groups, params hash {}", names.size(), hash);

        Map<String, RecordSummary> known = store.loadSummaries();
        List<String> todo = new ArrayList<>();
        for (String name : names) {
            states.put(name, GroupState.QUEUED);
            RecordSummary s = known.get(name);
            if (s != null && s.isAuthoritativeFor(hash)) {
                Optional<CacheRecord> cached = store.get(name);
                if (cached.isPresent() && cached.get().isAuthoritativeFor(hash)) {
                    states.put(name, GroupState.CACHED);
                    progress.onProgress(summary.recordCached(name, cached.get()), names.size(), name);
                    continue;
                }
            }
            todo.add(name);
        }
        logger.info("{} groups answered from cache, {} to process", summary.getCached(), todo.size());

        InferenceBatcher batcher = new InferenceBatcher(classifier, config.inferChunk,
                new CrowdPenalty(params.crowdHighScore, params.crowdHighCount, params.crowdHighPenalty),
                (name, scored, rect) -> persist(name, scored, rect, hash, summary, progress));

        if (!todo.isEmpty()) {
            drive(groups, todo, batcher, summary, progress);
        }

        summary.finish(stopRequested.get(), batcher.getClassifierCalls(), System.currentTimeMillis() - t0);
        logger.info("Run finished: {}", summary);
        return summary;
    }

    private void drive(Map<String, TripletPaths> groups, List<String> todo, InferenceBatcher batcher,
            RunSummary summary, ProgressListener progress) throws ClassifierException {
        ProcessingConfig config = ctx.getConfig();
        int maxInFlight = config.maxInFlight();
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, config.numWorkers), r -> {
            Thread t = new Thread(r, "stage-a-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ExecutorCompletionService<StageAOutcome> completion = new ExecutorCompletionService<>(pool);

        try {
            Iterator<String> it = todo.iterator();
            int inFlight = 0;
            while (!stopRequested.get()) {
                while (it.hasNext() && inFlight < maxInFlight && !stopRequested.get()) {
                    String name = it.next();
                    TripletPaths paths = groups.get(name);
                    states.put(name, GroupState.EXTRACTING);
                    completion.submit(() -> runStageA(name, paths));
                    inFlight++;
                }
                if (inFlight == 0) {
                    break;
                }
                Future<StageAOutcome> done = completion.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                inFlight--;
                handle(outcomeOf(done), batcher, summary, progress);
            }

            if (stopRequested.get()) {
                logger.info("Run stopped with {} patches of {} groups unscored",
                        batcher.getPendingItemCount(), batcher.getPendingGroupCount());
            } else {
                batcher.flush(true);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
            logger.warn("Run interrupted");
        } finally {
            pool.shutdownNow();
        }
    }

    private StageAOutcome runStageA(String name, TripletPaths paths) {
        try {
            return StageAOutcome.ok(name, extractor.extract(name, paths));
        } catch (IOException e) {
            return StageAOutcome.skipped(name, e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Stage A failed for {}", name, e);
            return StageAOutcome.failed(name, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (Error e) {
            // One oversized or malformed frame must not take the other groups down
            logger.error("Stage A error for {}", name, e);
            return StageAOutcome.failed(name, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static StageAOutcome outcomeOf(Future<StageAOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Stage A task died", e.getCause());
        }
    }

    private void handle(StageAOutcome outcome, InferenceBatcher batcher, RunSummary summary,
            ProgressListener progress) throws ClassifierException {
        String name = outcome.name;
        switch (outcome.kind) {
            case SKIPPED:
                states.put(name, GroupState.SKIPPED);
                logger.warn("Skipping {}: {}", name, outcome.message);
                progress.onProgress(summary.recordSkipped(name, outcome.message), summary.getTotal(), name);
                break;
            case FAILED:
                states.put(name, GroupState.FAILED);
                logger.warn("Group {} failed: {}", name, outcome.message);
                progress.onProgress(summary.recordFailure(name, outcome.message), summary.getTotal(), name);
                break;
            default:
                states.put(name, GroupState.SCORING);
                batcher.submit(outcome.result);
                break;
        }
    }

    /**
     * Completion of one scored group: merge human work from the stored record
     * and write the result once.
     */
    private void persist(String name, List<Candidate> scored, CropRect cropRect, String hash, RunSummary summary,
            ProgressListener progress) {
        states.put(name, GroupState.MERGING);
        RecordStore store = ctx.getStore();
        Optional<CacheRecord> existing = store.get(name);

        List<Candidate> merged = CandidateMerger.merge(scored,
                existing.map(CacheRecord::getCandidates).orElse(null));
        String status = existing.map(CacheRecord::getStatus).orElse(CacheRecord.STATUS_UNSEEN);
        CacheRecord record = new CacheRecord(status, merged, cropRect, hash, System.currentTimeMillis());
        store.put(name, record);

        states.put(name, GroupState.PERSISTED);
        logger.debug("Persisted {}: {} candidates, max ai {}", name, record.getCandidatesCount(),
                record.getMaxAi());
        progress.onProgress(summary.recordComputed(name, record), summary.getTotal(), name);
    }

    private enum OutcomeKind {
        OK, SKIPPED, FAILED
    }

    private static final class StageAOutcome {
        final String name;
        final OutcomeKind kind;
        final StageAResult result;
        final String message;

        private StageAOutcome(String name, OutcomeKind kind, StageAResult result, String message) {
            this.name = name;
            this.kind = kind;
            this.result = result;
            this.message = message;
        }

        static StageAOutcome ok(String name, StageAResult result) {
            return new StageAOutcome(name, OutcomeKind.OK, result, null);
        }

        static StageAOutcome skipped(String name, String message) {
            return new StageAOutcome(name, OutcomeKind.SKIPPED, null, message);
        }

        static StageAOutcome failed(String name, String message) {
            return new StageAOutcome(name, OutcomeKind.FAILED, null, message);
        }
    }
}
