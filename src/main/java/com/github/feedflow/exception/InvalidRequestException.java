package com.github.feedflow.exception;

/**
 * Exception thrown for malformed request parameters.
 */
public class InvalidRequestException extends StreamProxyException {

    private final String parameter;

    public InvalidRequestException(String message, String parameter) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
