package com.github.feedflow.service.extraction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command to completion with a wall-clock bound.
 * Both output streams are drained on the process I/O pool so a chatty child cannot block on a full pipe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessExecutor {

    @Qualifier("processIoExecutor")
    private final Executor processIoExecutor;

    /**
     * @throws IOException      if the process cannot be started or its output cannot be read;
     *                          a started process is killed
     * @throws TimeoutException if it does not exit within {@code timeout}; the process tree is killed
     */
    public ProcessResult run(List<String> command, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        log.debug("Executing: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command).start();

        try {
            process.getOutputStream().close();

            CompletableFuture<String> stdout = drain(process.getInputStream());
            CompletableFuture<String> stderr = drain(process.getErrorStream());

            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                kill(process);
                throw new TimeoutException("Process exceeded " + timeout.toSeconds() + "s: " + command.get(0));
            }

            return new ProcessResult(process.exitValue(), join(stdout), join(stderr));
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        } catch (RejectedExecutionException e) {
            kill(process);
            log.warn("Process I/O pool is saturated, killed {}", command.get(0));
            throw new IOException("Process I/O pool is saturated", e);
        } catch (IOException | RuntimeException | Error e) {
            kill(process);
            throw e;
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, processIoExecutor);
    }

    private String join(CompletableFuture<String> output) throws IOException, InterruptedException {
        try {
            // The process has exited, so the pipe closes promptly
            return output.get(10, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            throw new IOException("Failed to read process output", cause);
        } catch (TimeoutException e) {
            // A grandchild may still hold the pipe open
            output.cancel(true);
            throw new IOException("Timed out reading process output", e);
        }
    }

    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
