package com.github.feedflow.exception;

import com.github.feedflow.model.MediaKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.HttpStatus;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Hierarchy")
class ExceptionHierarchyTest {

    @Nested
    @DisplayName("StreamProxyException")
    class StreamProxyExceptionTests {

        @Test
        @DisplayName("should extend RuntimeException")
        void shouldExtendRuntimeException() {
            assertInstanceOf(RuntimeException.class, new StreamProxyException("Test error"));
        }

        @Test
        @DisplayName("should create with message and cause")
        void shouldCreateWithMessageAndCause() {
            Exception cause = new RuntimeException("Root cause");
            StreamProxyException ex = new StreamProxyException("Proxy failed", cause);

            assertEquals("Proxy failed", ex.getMessage());
            assertEquals(cause, ex.getCause());
        }

        @Test
        @DisplayName("should create with cause only")
        void shouldCreateWithCauseOnly() {
            Exception cause = new RuntimeException("Root cause");

            assertEquals(cause, new StreamProxyException(cause).getCause());
        }
    }

    @Nested
    @DisplayName("ExtractionException")
    class ExtractionExceptionTests {

        @Test
        @DisplayName("should capture video id, reason and exit code")
        void shouldCaptureFields() {
            ExtractionException ex = new ExtractionException("Sign in", "dQw4w9WgXcQ",
                    ExtractionException.Reason.BOT_CHECK, 1);

            assertEquals("Sign in", ex.getMessage());
            assertEquals("dQw4w9WgXcQ", ex.getVideoId());
            assertEquals(ExtractionException.Reason.BOT_CHECK, ex.getReason());
            assertEquals(Integer.valueOf(1), ex.getExitCode());
        }

        @Test
        @DisplayName("subclasses should carry their fixed reason")
        void subclassesShouldCarryReason() {
            assertEquals(ExtractionException.Reason.NOT_FOUND,
                    new VideoNotFoundException("Video unavailable", "x").getReason());
            assertEquals(ExtractionException.Reason.ENVIRONMENT,
                    new EnvironmentFailureException("spawn ENOENT", "x", "yt-dlp").getReason());
            assertEquals(ExtractionException.Reason.TIMEOUT,
                    new ExtractionTimeoutException("x", Duration.ofSeconds(90)).getReason());
        }

        @Test
        @DisplayName("timeout should report its bound")
        void timeoutShouldReportBound() {
            ExtractionTimeoutException ex = new ExtractionTimeoutException("x", Duration.ofSeconds(90));

            assertEquals("Extraction timed out after 90s", ex.getMessage());
            assertEquals(Duration.ofSeconds(90), ex.getTimeout());
        }

        @Test
        @DisplayName("environment failure should name the binary")
        void environmentFailureShouldNameBinary() {
            Exception cause = new IOException("error=13");
            EnvironmentFailureException ex = new EnvironmentFailureException("denied", cause, "x", "/opt/yt-dlp");

            assertEquals("/opt/yt-dlp", ex.getBinary());
            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("StreamTokenException")
    class StreamTokenExceptionTests {

        @Test
        @DisplayName("missing and expired tokens should be 401, invalid 403")
        void failuresShouldMapToStatuses() {
            assertEquals(HttpStatus.UNAUTHORIZED, StreamTokenException.Failure.MISSING.getStatus());
            assertEquals(HttpStatus.UNAUTHORIZED, StreamTokenException.Failure.EXPIRED.getStatus());
            assertEquals(HttpStatus.FORBIDDEN, StreamTokenException.Failure.INVALID.getStatus());
        }

        @ParameterizedTest
        @EnumSource(StreamTokenException.Failure.class)
        @DisplayName("message should match the failure")
        void messageShouldMatchFailure(StreamTokenException.Failure failure) {
            StreamTokenException ex = new StreamTokenException(failure);

            assertEquals(failure.getMessage(), ex.getMessage());
            assertEquals(failure, ex.getFailure());
        }
    }

    @Nested
    @DisplayName("BinaryDownloadException")
    class BinaryDownloadExceptionTests {

        @Test
        @DisplayName("should capture source URL and status code")
        void shouldCaptureSourceAndStatus() {
            BinaryDownloadException ex = new BinaryDownloadException("Failed to download yt-dlp (404)",
                    "https://github.com/yt-dlp/yt-dlp/releases/latest/download/yt-dlp_linux", 404);

            assertEquals(Integer.valueOf(404), ex.getStatusCode());
            assertTrue(ex.getSourceUrl().endsWith("/yt-dlp_linux"));
        }

        @Test
        @DisplayName("status code should be absent for I/O failures")
        void statusShouldBeAbsentForIoFailures() {
            BinaryDownloadException ex = new BinaryDownloadException("reset", new IOException(), "u");

            assertNull(ex.getStatusCode());
        }
    }

    @Test
    @DisplayName("request errors should carry their context")
    void requestErrorsShouldCarryContext() {
        assertEquals("No stream URL found", new StreamNotFoundException("x", MediaKind.AUDIO).getMessage());
        assertEquals(MediaKind.AUDIO, new StreamNotFoundException("x", MediaKind.AUDIO).getKind());
        assertEquals("No playable streams found", new NoPlayableStreamException("x").getMessage());
        assertEquals("Unauthorized", new StreamAccessDeniedException().getMessage());
        assertEquals("type", new InvalidRequestException("Invalid type", "type").getParameter());
        assertEquals("feedflow.network.proxy-url",
                new ConfigurationException("Bad proxy", "feedflow.network.proxy-url").getConfigKey());
    }

    @Test
    @DisplayName("all custom exceptions should be catchable as StreamProxyException")
    void allCustomExceptionsShouldBeCatchableAsStreamProxyException() {
        List<RuntimeException> exceptions = List.of(
                new ExtractionException("e", "x", ExtractionException.Reason.TOOL_ERROR),
                new VideoNotFoundException("e", "x"),
                new BinaryDownloadException("e", "u"),
                new StreamTokenException(StreamTokenException.Failure.INVALID),
                new UpstreamFetchException("e", new IOException(), "x"),
                new ConfigurationException("e", "k"),
                new InvalidRequestException("e", "p"),
                new StreamAccessDeniedException());

        for (RuntimeException ex : exceptions) {
            assertInstanceOf(StreamProxyException.class, ex, ex.getClass().getSimpleName());
        }
    }
}
