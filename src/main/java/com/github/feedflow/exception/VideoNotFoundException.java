package com.github.feedflow.exception;

/**
 * Exception thrown when the upstream reports that a video does not exist.
 */
public class VideoNotFoundException extends ExtractionException {

    public VideoNotFoundException(String message, String videoId) {
        super(message, videoId, Reason.NOT_FOUND);
    }
}
