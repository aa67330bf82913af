package com.github.feedflow.exception;

/**
 * Exception thrown when the extraction tool cannot run on this host
 * (missing interpreter, permission denied, failed spawn).
 */
public class EnvironmentFailureException extends ExtractionException {

    private final String binary;

    public EnvironmentFailureException(String message, String videoId, String binary) {
        super(message, videoId, Reason.ENVIRONMENT);
        this.binary = binary;
    }

    public EnvironmentFailureException(String message, Throwable cause, String videoId, String binary) {
        super(message, cause, videoId, Reason.ENVIRONMENT);
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }
}
