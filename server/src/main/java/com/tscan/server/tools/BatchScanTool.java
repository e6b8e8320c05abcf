package com.tscan.server.tools;

import com.tscan.db.SqliteRecordStore;
import com.tscan.server.detect.TripletDirectoryScanner;
import com.tscan.server.infer.ClassifierException;
import com.tscan.server.infer.OnnxPatchClassifier;
import com.tscan.server.pipeline.PipelineContext;
import com.tscan.server.pipeline.PipelineOrchestrator;
import com.tscan.server.pipeline.RunSummary;
import com.tscan.server.util.DataPathResolver;
import com.tscan.server.util.ScanConfig;
import com.tscan.server.util.ScanConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Offline tool that runs one full pass over a directory of triplets and fills
 * the SQLite cache.
 * Usage: BatchScanTool <directory>
 */
public class BatchScanTool {

    private static final Logger logger = LoggerFactory.getLogger(BatchScanTool.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: BatchScanTool <directory>");
            System.exit(1);
        }

        File dir = new File(args[0]);
        if (!dir.exists() || !dir.isDirectory()) {
            System.err.println("Invalid directory: " + args[0]);
            System.exit(1);
        }

        int exitCode = run(dir);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(File dir) {
        ScanConfig config = ScanConfigLoader.load();
        logger.info("Starting batch scan of {}", dir);

        PipelineContext ctx = null;
        try {
            TripletDirectoryScanner scanner = TripletDirectoryScanner.scan(dir.toPath());
            if (scanner.getCompleteGroups().isEmpty()) {
                logger.warn("No complete triplets found, exiting.");
                return 0;
            }

            OnnxPatchClassifier classifier = new OnnxPatchClassifier(Paths.get(config.detection.modelPath),
                    config.processing.resizeHw, config.useGpu);
            SqliteRecordStore store;
            try {
                store = new SqliteRecordStore(DataPathResolver.resolveDbPath(config),
                        Paths.get(DataPathResolver.resolveLegacyJsonPath(config)), config.processing);
            } catch (Exception e) {
                classifier.close();
                throw e;
            }
            ctx = new PipelineContext(config.detection, config.processing, store, classifier);

            PipelineOrchestrator orchestrator = new PipelineOrchestrator(ctx);
            Runtime.getRuntime().addShutdownHook(new Thread(orchestrator::requestStop));

            RunSummary summary = orchestrator.run(scanner.getCompleteGroups(), (n, total, label) -> {
                if (n % 100 == 0 || n == total) {
                    logger.info("Processed {}/{}", n, total);
                }
            });

            System.out.println(summary);
            for (Map.Entry<String, String> e : summary.getSkipped().entrySet()) {
                System.out.println("skipped " + e.getKey() + ": " + e.getValue());
            }
            for (Map.Entry<String, String> e : summary.getFailures().entrySet()) {
                System.out.println("failed  " + e.getKey() + ": " + e.getValue());
            }
            return 0;
        } catch (ClassifierException e) {
            logger.error("Batch scan aborted: classifier failure", e);
            return 2;
        } catch (Exception e) {
            logger.error("Batch scan failed", e);
            return 1;
        } finally {
            if (ctx != null) {
                ctx.close();
            }
        }
    }
}
