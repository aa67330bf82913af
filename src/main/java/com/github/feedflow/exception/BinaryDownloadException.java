package com.github.feedflow.exception;

/**
 * Exception thrown when the fallback extraction binary cannot be fetched or installed.
 */
public class BinaryDownloadException extends StreamProxyException {

    private final String sourceUrl;
    private final Integer statusCode;

    public BinaryDownloadException(String message, String sourceUrl) {
        super(message);
        this.sourceUrl = sourceUrl;
        this.statusCode = null;
    }

    public BinaryDownloadException(String message, String sourceUrl, Integer statusCode) {
        super(message);
        this.sourceUrl = sourceUrl;
        this.statusCode = statusCode;
    }

    public BinaryDownloadException(String message, Throwable cause, String sourceUrl) {
        super(message, cause);
        this.sourceUrl = sourceUrl;
        this.statusCode = null;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
