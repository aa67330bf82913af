package com.github.feedflow.exception;

import com.github.feedflow.model.MediaKind;

/**
 * Exception thrown when the resolved stream has no URL for the requested media kind.
 */
public class StreamNotFoundException extends StreamProxyException {

    private final String videoId;
    private final MediaKind kind;

    public StreamNotFoundException(String videoId, MediaKind kind) {
        super("No stream URL found");
        this.videoId = videoId;
        this.kind = kind;
    }

    public String getVideoId() {
        return videoId;
    }

    public MediaKind getKind() {
        return kind;
    }
}
