package com.dnsguard.detection.engine.scoring;

/**
 * No fitted outlier model is available. Recoverable by training or loading an artifact;
 * never retried internally.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }
}
