package com.github.feedflow.exception;

import java.time.Duration;

/**
 * Exception thrown when an extraction subprocess exceeds its wall-clock limit.
 */
public class ExtractionTimeoutException extends ExtractionException {

    private final Duration timeout;

    public ExtractionTimeoutException(String videoId, Duration timeout) {
        super("Extraction timed out after " + timeout.toSeconds() + "s", videoId, Reason.TIMEOUT);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
