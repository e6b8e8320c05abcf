package com.tscan.server.service;

import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.infer.ClassifierException;
import com.tscan.server.infer.PatchClassifier;

@FunctionalInterface
public interface ClassifierFactory {

    PatchClassifier open(DetectionParameters params) throws ClassifierException;
}
