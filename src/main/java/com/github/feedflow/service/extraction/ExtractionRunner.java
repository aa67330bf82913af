package com.github.feedflow.service.extraction;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.exception.EnvironmentFailureException;
import com.github.feedflow.exception.ExtractionException;
import com.github.feedflow.exception.ExtractionTimeoutException;
import com.github.feedflow.exception.VideoNotFoundException;
import com.github.feedflow.model.ExtractionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Turns a video id into format metadata by running yt-dlp.
 * <p>
 * Transient network errors are retried by the tool itself ({@code --retries}). When the
 * configured binary cannot run on this host the runner installs the standalone release
 * build once and uses it for the rest of the process lifetime.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionRunner {

    private final StreamProxyProperties properties;
    private final ProcessExecutor processExecutor;
    private final ExtractionErrorClassifier errorClassifier;
    private final YtDlpOutputParser outputParser;
    private final FallbackBinaryInstaller fallbackInstaller;

    // Written once under the lock, read without it
    private volatile Path fallbackBinary;

    public ExtractionResult resolve(String videoId) {
        Path fallback = fallbackBinary;
        String binary = fallback != null ? fallback.toString() : properties.getExtractor().getBinary();

        try {
            return runOnce(videoId, binary);
        } catch (EnvironmentFailureException e) {
            if (fallback != null) {
                throw e;
            }
            log.warn("yt-dlp cannot run on this host ({}), switching to standalone binary", e.getMessage());
            Path installed = switchToFallback();
            return runOnce(videoId, installed.toString());
        }
    }

    boolean isUsingFallback() {
        return fallbackBinary != null;
    }

    private Path switchToFallback() {
        Path installed = fallbackInstaller.ensureInstalled();
        synchronized (this) {
            if (fallbackBinary == null) {
                fallbackBinary = installed;
                log.info("Extraction now uses fallback binary {}", installed);
            }
            return fallbackBinary;
        }
    }

    private ExtractionResult runOnce(String videoId, String binary) {
        List<String> command = buildCommand(binary, videoId);
        Duration timeout = Duration.ofSeconds(properties.getExtractor().getTimeoutSeconds());

        ProcessResult result;
        try {
            result = processExecutor.run(command, timeout);
        } catch (IOException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            if (errorClassifier.isEnvironmentFailure(message)) {
                throw new EnvironmentFailureException(message, e, videoId, binary);
            }
            throw new ExtractionException("Failed to run extraction tool: " + message, e, videoId,
                    ExtractionException.Reason.TOOL_ERROR);
        } catch (TimeoutException e) {
            log.warn("Extraction of {} timed out after {}s", videoId, timeout.toSeconds());
            throw new ExtractionTimeoutException(videoId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Extraction interrupted", e, videoId, ExtractionException.Reason.TOOL_ERROR);
        }

        if (result.isSuccess()) {
            ExtractionResult extraction = outputParser.parse(videoId, result.getStdout());
            log.info("Extracted {} formats for {}", extraction.getFormats().size(), videoId);
            return extraction;
        }

        String output = result.combinedOutput();
        ExtractionException.Reason reason = errorClassifier.classify(output);
        String summary = errorClassifier.summarize(output);
        log.warn("yt-dlp exited with code {} for {} ({}): {}", result.getExitCode(), videoId, reason, summary);

        switch (reason) {
            case ENVIRONMENT -> throw new EnvironmentFailureException(summary, videoId, binary);
            case NOT_FOUND -> throw new VideoNotFoundException(summary, videoId);
            default -> throw new ExtractionException(summary, videoId, reason, result.getExitCode());
        }
    }

    List<String> buildCommand(String binary, String videoId) {
        StreamProxyProperties.Extractor extractor = properties.getExtractor();

        List<String> command = new ArrayList<>();
        command.add(binary);
        command.add(extractor.getWatchUrlPrefix() + videoId);
        command.add("--dump-single-json");
        command.add("--no-check-certificates");
        command.add("--no-warnings");
        command.add("--prefer-free-formats");
        command.add("--socket-timeout");
        command.add(String.valueOf(extractor.getSocketTimeoutSeconds()));
        command.add("--retries");
        command.add(String.valueOf(extractor.getRetries()));

        if (properties.getNetwork().isProxyConfigured()) {
            command.add("--proxy");
            command.add(properties.getNetwork().getProxyUrl().trim());
        }
        if (extractor.hasCookies()) {
            command.add("--cookies");
            command.add(extractor.getCookiesPath().trim());
        }

        return command;
    }
}
