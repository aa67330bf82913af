package com.github.feedflow.exception;

/**
 * Base exception for all stream resolution and proxy errors.
 */
public class StreamProxyException extends RuntimeException {

    public StreamProxyException(String message) {
        super(message);
    }

    public StreamProxyException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamProxyException(Throwable cause) {
        super(cause);
    }
}
