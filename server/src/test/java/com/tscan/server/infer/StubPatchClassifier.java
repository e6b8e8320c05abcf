package com.tscan.server.infer;

import com.tscan.server.detect.PatchTensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Classifier double that scores with a function of the patch and records every
 * call.
 */
public class StubPatchClassifier implements PatchClassifier {

    private final ToDoubleFunction<PatchTensor> scorer;
    private final List<Integer> batchSizes = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean failOnScore = false;
    private volatile boolean failOnReady = false;
    private volatile boolean closed = false;
    private String modelIdentity = "stub-model";

    public StubPatchClassifier(double constantScore) {
        this(p -> constantScore);
    }

    public StubPatchClassifier(ToDoubleFunction<PatchTensor> scorer) {
        this.scorer = scorer;
    }

    public StubPatchClassifier failOnScore() {
        this.failOnScore = true;
        return this;
    }

    public StubPatchClassifier failOnReady() {
        this.failOnReady = true;
        return this;
    }

    public StubPatchClassifier withModelIdentity(String identity) {
        this.modelIdentity = identity;
        return this;
    }

    @Override
    public String getModelIdentity() {
        return modelIdentity;
    }

    @Override
    public double[] score(List<PatchTensor> batch) throws ClassifierException {
        batchSizes.add(batch.size());
        if (failOnScore) {
            throw new ClassifierException("stub failure");
        }
        double[] out = new double[batch.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = scorer.applyAsDouble(batch.get(i));
        }
        return out;
    }

    @Override
    public void verifyReady() throws ClassifierException {
        if (failOnReady) {
            throw new ClassifierException("stub model missing");
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    public int getCalls() {
        return batchSizes.size();
    }

    public List<Integer> getBatchSizes() {
        return new ArrayList<>(batchSizes);
    }

    public boolean isClosed() {
        return closed;
    }
}
