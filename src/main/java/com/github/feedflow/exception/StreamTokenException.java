package com.github.feedflow.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a proxy request carries a missing, expired or forged capability token.
 * Always terminal; the client has to request a fresh stream URL.
 */
public class StreamTokenException extends StreamProxyException {

    public enum Failure {
        MISSING(HttpStatus.UNAUTHORIZED, "Missing stream token"),
        EXPIRED(HttpStatus.UNAUTHORIZED, "Expired stream token"),
        INVALID(HttpStatus.FORBIDDEN, "Invalid stream token");

        private final HttpStatus status;
        private final String message;

        Failure(HttpStatus status, String message) {
            this.status = status;
            this.message = message;
        }

        public HttpStatus getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Failure failure;

    public StreamTokenException(Failure failure) {
        super(failure.getMessage());
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }
}
