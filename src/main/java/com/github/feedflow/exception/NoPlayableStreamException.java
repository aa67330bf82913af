package com.github.feedflow.exception;

/**
 * Exception thrown when format selection left no usable URL for the requested kinds.
 */
public class NoPlayableStreamException extends StreamProxyException {

    private final String videoId;

    public NoPlayableStreamException(String videoId) {
        super("No playable streams found");
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }
}
