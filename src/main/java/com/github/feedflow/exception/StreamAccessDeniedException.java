package com.github.feedflow.exception;

/**
 * Exception thrown when a /stream request is not authorized to mint proxy URLs.
 */
public class StreamAccessDeniedException extends StreamProxyException {

    public StreamAccessDeniedException() {
        super("Unauthorized");
    }
}
