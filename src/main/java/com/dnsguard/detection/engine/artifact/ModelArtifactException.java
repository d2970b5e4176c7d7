package com.dnsguard.detection.engine.artifact;

public class ModelArtifactException extends RuntimeException {

    public ModelArtifactException(String message) {
        super(message);
    }

    public ModelArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
