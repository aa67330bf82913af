package com.github.feedflow.controller;

import com.github.feedflow.exception.BinaryDownloadException;
import com.github.feedflow.exception.ExtractionException;
import com.github.feedflow.exception.ExtractionTimeoutException;
import com.github.feedflow.exception.InvalidRequestException;
import com.github.feedflow.exception.NoPlayableStreamException;
import com.github.feedflow.exception.StreamAccessDeniedException;
import com.github.feedflow.exception.StreamNotFoundException;
import com.github.feedflow.exception.StreamProxyException;
import com.github.feedflow.exception.StreamTokenException;
import com.github.feedflow.exception.UpstreamFetchException;
import com.github.feedflow.exception.VideoNotFoundException;
import com.github.feedflow.model.ErrorResponse;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.RejectedExecutionException;

/**
 * Maps stream errors to a status and a minimal JSON body.
 * Upstream URLs and stack traces stay in the logs.
 */
@Slf4j
@RestControllerAdvice
public class StreamExceptionHandler {

    static final String BOT_CHECK_HINT = "YouTube blocked this server (bot check). Configure yt-dlp cookies "
            + "(feedflow.extractor.cookies-path) or switch the outbound proxy exit, then restart.";
    static final String COOKIES_INVALID_HINT = "YouTube cookies are configured but invalid or rotated. "
            + "Re-export cookies, reinstall them and restart.";

    @ExceptionHandler(StreamAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(StreamAccessDeniedException e) {
        return respond(HttpStatus.UNAUTHORIZED, ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(StreamTokenException.class)
    public ResponseEntity<ErrorResponse> handleToken(StreamTokenException e) {
        log.warn("Rejected proxy request: {}", e.getMessage());
        return respond(e.getFailure().getStatus(), ErrorResponse.of(e.getFailure().getMessage()));
    }

    @ExceptionHandler(NoPlayableStreamException.class)
    public ResponseEntity<ErrorResponse> handleNoPlayableStream(NoPlayableStreamException e) {
        log.info("No playable stream for {}", e.getVideoId());
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(StreamNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleStreamNotFound(StreamNotFoundException e) {
        log.info("No {} stream for {}", e.getKind().getWireName(), e.getVideoId());
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(VideoNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleVideoNotFound(VideoNotFoundException e) {
        log.info("Video not found: {} ({})", e.getVideoId(), e.getMessage());
        return respond(HttpStatus.NOT_FOUND, new ErrorResponse("Video not found", "VIDEO_NOT_FOUND"));
    }

    @ExceptionHandler(ExtractionTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleExtractionTimeout(ExtractionTimeoutException e) {
        log.error("Extraction timed out for {}", e.getVideoId());
        return respond(HttpStatus.GATEWAY_TIMEOUT,
                new ErrorResponse("Timed out resolving stream", "EXTRACTION_TIMEOUT"));
    }

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ErrorResponse> handleExtraction(ExtractionException e) {
        log.error("Extraction failed for {} ({}): {}", e.getVideoId(), e.getReason(), e.getMessage());

        return switch (e.getReason()) {
            case BOT_CHECK -> respond(HttpStatus.SERVICE_UNAVAILABLE,
                    new ErrorResponse(BOT_CHECK_HINT, "YOUTUBE_BOT_CHECK"));
            case COOKIES_INVALID -> respond(HttpStatus.SERVICE_UNAVAILABLE,
                    new ErrorResponse(COOKIES_INVALID_HINT, "YOUTUBE_COOKIES_INVALID"));
            case LIVE_NOT_STARTED -> respond(HttpStatus.CONFLICT,
                    new ErrorResponse(e.getMessage(), "LIVE_NOT_STARTED"));
            case NOT_FOUND -> respond(HttpStatus.NOT_FOUND,
                    new ErrorResponse("Video not found", "VIDEO_NOT_FOUND"));
            default -> respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of("Failed to get stream URLs"));
        };
    }

    @ExceptionHandler(BinaryDownloadException.class)
    public ResponseEntity<ErrorResponse> handleBinaryDownload(BinaryDownloadException e) {
        log.error("Fallback extraction binary unavailable: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                new ErrorResponse("Stream backend unavailable", "STREAM_BACKEND_UNAVAILABLE"));
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamFetch(UpstreamFetchException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejected(RejectedExecutionException e, HttpServletResponse response) {
        log.warn("Request rejected, worker pool is saturated: {}", e.getMessage());
        if (!response.isCommitted()) {
            // Drop headers already copied from an upstream response
            response.reset();
        }
        return respond(HttpStatus.SERVICE_UNAVAILABLE, new ErrorResponse("Server busy, try again", "SERVER_BUSY"));
    }

    @ExceptionHandler(StreamProxyException.class)
    public ResponseEntity<ErrorResponse> handleOther(StreamProxyException e) {
        log.error("Stream request failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of("Internal error"));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        // Explicit type: media players send Accept headers that exclude JSON
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
