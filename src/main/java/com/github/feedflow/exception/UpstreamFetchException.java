package com.github.feedflow.exception;

/**
 * Exception thrown when the proxy cannot reach a resolved upstream URL.
 * Not retried; the cached URL may have expired upstream.
 */
public class UpstreamFetchException extends StreamProxyException {

    private final String videoId;

    public UpstreamFetchException(String message, Throwable cause, String videoId) {
        super(message, cause);
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }
}
