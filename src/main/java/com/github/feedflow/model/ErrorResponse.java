package com.github.feedflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Minimal JSON error body. Never carries upstream URLs or stack traces.
 */
@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    String error;
    String code;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
