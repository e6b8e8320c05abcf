package com.tscan.server.infer;

import com.tscan.server.detect.PatchTensor;

import java.util.List;

/**
 * Real/bogus classifier over candidate patches. Implementations own a hardware
 * context that is not safe for concurrent calls; the inference batcher is the
 * only caller.
 */
public interface PatchClassifier extends AutoCloseable {

    /**
     * Identity of the loaded model, part of the cache invalidation key.
     */
    String getModelIdentity();

    /**
     * Probability of the "real" class for each patch, in input order.
     */
    double[] score(List<PatchTensor> batch) throws ClassifierException;

    /**
     * Dry run that fails fast when the model cannot be evaluated.
     */
    void verifyReady() throws ClassifierException;

    @Override
    void close();
}
