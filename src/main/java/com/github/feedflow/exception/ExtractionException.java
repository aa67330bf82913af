package com.github.feedflow.exception;

/**
 * Exception thrown when the extraction tool cannot produce stream metadata for a video.
 */
public class ExtractionException extends StreamProxyException {

    /**
     * Why the extraction failed, as far as the tool output tells.
     */
    public enum Reason {
        /** Upstream reports the video does not exist or is not viewable. */
        NOT_FOUND,
        /** Upstream demands a sign-in or bot check. */
        BOT_CHECK,
        /** Configured cookies were rejected or rotated. */
        COOKIES_INVALID,
        /** Scheduled live event that has not started yet. */
        LIVE_NOT_STARTED,
        /** The tool could not run at all on this host. */
        ENVIRONMENT,
        /** The tool did not finish within the wall-clock bound. */
        TIMEOUT,
        /** Any other tool failure. */
        TOOL_ERROR
    }

    private final String videoId;
    private final Reason reason;
    private final Integer exitCode;

    public ExtractionException(String message, String videoId, Reason reason) {
        super(message);
        this.videoId = videoId;
        this.reason = reason;
        this.exitCode = null;
    }

    public ExtractionException(String message, String videoId, Reason reason, Integer exitCode) {
        super(message);
        this.videoId = videoId;
        this.reason = reason;
        this.exitCode = exitCode;
    }

    public ExtractionException(String message, Throwable cause, String videoId, Reason reason) {
        super(message, cause);
        this.videoId = videoId;
        this.reason = reason;
        this.exitCode = null;
    }

    public String getVideoId() {
        return videoId;
    }

    public Reason getReason() {
        return reason;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
