package com.tscan.server.service;

import com.tscan.db.CacheRecord;
import com.tscan.db.RecordStore;
import com.tscan.db.RecordSummary;
import com.tscan.db.SqliteRecordStore;
import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.detect.TripletDirectoryScanner;
import com.tscan.server.infer.ClassifierException;
import com.tscan.server.infer.OnnxPatchClassifier;
import com.tscan.server.infer.PatchClassifier;
import com.tscan.server.pipeline.GroupState;
import com.tscan.server.pipeline.PipelineContext;
import com.tscan.server.pipeline.PipelineOrchestrator;
import com.tscan.server.pipeline.RunSummary;
import com.tscan.server.util.DataPathResolver;
import com.tscan.server.util.ScanConfig;
import com.tscan.server.util.ScanConfigLoader;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the record store and at most one background scan run. The viewer reads
 * and edits records through this service while a run is active.
 */
@Service
public class ScanService {

    private static final Logger logger = LoggerFactory.getLogger(ScanService.class);

    private final ScanConfig config;
    private final RecordStore store;
    private final ClassifierFactory classifierFactory;

    private DetectionParameters parameters;

    private volatile PipelineOrchestrator current;
    private volatile Thread runThread;
    private volatile String directory;
    private volatile int processed;
    private volatile int total;
    private volatile String currentItem;
    private volatile int incompleteGroups;
    private volatile RunSummary lastSummary;
    private volatile String lastError;

    public ScanService() throws SQLException {
        this(ScanConfigLoader.load());
    }

    private ScanService(ScanConfig config) throws SQLException {
        this(config,
                new SqliteRecordStore(DataPathResolver.resolveDbPath(config),
                        Paths.get(DataPathResolver.resolveLegacyJsonPath(config)), config.processing),
                params -> new OnnxPatchClassifier(Paths.get(params.modelPath), config.processing.resizeHw,
                        config.useGpu));
    }

    public ScanService(ScanConfig config, RecordStore store, ClassifierFactory classifierFactory) {
        this.config = config;
        this.store = store;
        this.classifierFactory = classifierFactory;
        this.parameters = config.detection.copy();
    }

    public synchronized DetectionParameters getParameters() {
        return parameters.copy();
    }

    /**
     * Takes effect from the next run.
     */
    public synchronized void updateParameters(DetectionParameters updated) {
        this.parameters = updated.copy();
        logger.info("Detection parameters updated");
    }

    public boolean isRunning() {
        Thread t = runThread;
        return t != null && t.isAlive();
    }

    /**
     * Scans {@code dir} for complete triplets and starts a background run.
     *
     * @throws IllegalStateException a run is already active
     * @throws IOException           the directory cannot be listed
     * @throws ClassifierException   the classifier cannot be loaded
     */
    public synchronized ScanStatus startScan(String dir) throws IOException, ClassifierException {
        if (isRunning()) {
            throw new IllegalStateException("A scan is already running on " + directory);
        }
        TripletDirectoryScanner scanner = TripletDirectoryScanner.scan(Paths.get(dir));
        DetectionParameters snapshot = parameters.copy();
        PatchClassifier classifier = classifierFactory.open(snapshot);

        PipelineContext ctx = new PipelineContext(snapshot, config.processing, store, classifier);
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(ctx);

        this.current = orchestrator;
        this.directory = dir;
        this.processed = 0;
        this.total = scanner.getCompleteGroups().size();
        this.currentItem = null;
        this.incompleteGroups = scanner.getIncompleteGroups().size();
        this.lastError = null;

        Thread t = new Thread(() -> {
            try {
                lastSummary = orchestrator.run(scanner.getCompleteGroups(), (n, of, label) -> {
                    processed = n;
                    total = of;
                    currentItem = label;
                });
            } catch (ClassifierException e) {
                lastError = e.getMessage();
                logger.error("Scan of {} aborted by classifier failure", dir, e);
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                logger.error("Scan of {} failed", dir, e);
            } finally {
                classifier.close();
            }
        }, "scan-run");
        t.setDaemon(true);
        this.runThread = t;
        t.start();
        logger.info("Started scan of {} ({} groups, {} incomplete)", dir, total, incompleteGroups);
        return getStatus();
    }

    /**
     * @return false when no run is active
     */
    public boolean stop() {
        PipelineOrchestrator o = current;
        if (o == null || !isRunning()) {
            return false;
        }
        o.requestStop();
        return true;
    }

    public ScanStatus getStatus() {
        ScanStatus s = new ScanStatus();
        s.running = isRunning();
        s.directory = directory;
        s.processed = processed;
        s.total = total;
        s.currentItem = currentItem;
        s.incompleteGroups = incompleteGroups;
        s.pendingWrites = store.getPendingWriteCount();
        PipelineOrchestrator o = current;
        if (o != null) {
            for (GroupState state : o.getGroupStates().values()) {
                s.groupStates.merge(state, 1, Integer::sum);
            }
        }
        RunSummary last = lastSummary;
        if (last != null) {
            s.paramsHash = last.getParamsHash();
            s.computed = last.getComputed();
            s.cached = last.getCached();
            s.skipped = last.getSkipped().size();
            s.failed = last.getFailures().size();
            s.classifierCalls = last.getClassifierCalls();
            s.stopped = last.isStopped();
            s.elapsedMs = last.getElapsedMs();
        }
        s.error = lastError;
        return s;
    }

    public RunSummary getLastSummary() {
        return lastSummary;
    }

    public Map<String, RecordSummary> listRecords() {
        return store.loadSummaries();
    }

    public Optional<CacheRecord> getRecord(String stem) {
        return store.get(stem);
    }

    /**
     * @return false when there is no record for {@code stem}
     */
    public boolean markStatus(String stem, String status) {
        if (store.get(stem).isEmpty()) {
            return false;
        }
        store.markStatus(stem, status);
        return true;
    }

    public boolean delete(String stem) {
        if (store.get(stem).isEmpty()) {
            return false;
        }
        store.delete(stem);
        return true;
    }

    public void clearAll() {
        store.clearAll();
    }

    /**
     * Waits for the active run, if any, up to {@code timeoutMs}.
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        Thread t = runThread;
        if (t == null) {
            return true;
        }
        t.join(timeoutMs);
        return !t.isAlive();
    }

    @PreDestroy
    public void shutdown() {
        stop();
        try {
            if (!awaitIdle(30_000)) {
                logger.warn("Scan run still active at shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        store.close();
    }
}
