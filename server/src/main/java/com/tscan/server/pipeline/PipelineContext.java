package com.tscan.server.pipeline;

import com.tscan.db.RecordStore;
import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.detect.ProcessingConfig;
import com.tscan.server.infer.PatchClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything a run shares: parameter snapshot, record store and classifier.
 * Built once before the first group is scheduled; {@link #close()} drains the
 * store's writer and releases the classifier.
 */
public class PipelineContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PipelineContext.class);

    private final DetectionParameters params;
    private final ProcessingConfig config;
    private final RecordStore store;
    private final PatchClassifier classifier;

    public PipelineContext(DetectionParameters params, ProcessingConfig config, RecordStore store,
            PatchClassifier classifier) {
        this.params = params.copy();
        this.config = config;
        this.store = store;
        this.classifier = classifier;
    }

    public DetectionParameters getParams() {
        return params;
    }

    public ProcessingConfig getConfig() {
        return config;
    }

    public RecordStore getStore() {
        return store;
    }

    public PatchClassifier getClassifier() {
        return classifier;
    }

    @Override
    public void close() {
        try {
            store.close();
        } finally {
            classifier.close();
            logger.info("Pipeline context closed");
        }
    }
}
