package com.tscan.server.infer;

/**
 * Classifier could not be loaded or a call failed. Fatal to a pipeline run:
 * continuing would leave the remaining candidates without scores.
 */
public class ClassifierException extends Exception {

    public ClassifierException(String message) {
        super(message);
    }

    public ClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
