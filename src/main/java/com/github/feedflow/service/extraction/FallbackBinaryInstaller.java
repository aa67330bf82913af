package com.github.feedflow.service.extraction;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.exception.BinaryDownloadException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Downloads a self-contained yt-dlp build for this platform into a local cache directory.
 * <p>
 * Only one download runs at a time: callers arriving while it is in progress wait for it and
 * share its outcome. A failed download frees the slot so a later request can try again;
 * a successful one is remembered for the life of the process.
 */
@Slf4j
@Component
public class FallbackBinaryInstaller {

    private final OkHttpClient proxiedClient;
    private final OkHttpClient directClient;
    private final String downloadBaseUrl;
    private final Path installDir;
    private final String assetName;

    private final AtomicReference<CompletableFuture<Path>> installation = new AtomicReference<>();

    @Autowired
    public FallbackBinaryInstaller(StreamProxyProperties properties,
                                   @Qualifier("upstreamHttpClient") OkHttpClient upstreamHttpClient,
                                   @Qualifier("directHttpClient") OkHttpClient directHttpClient) {
        this(properties.getNetwork().isProxyConfigured() ? upstreamHttpClient : null,
                directHttpClient,
                properties.getExtractor().getNormalizedDownloadBaseUrl(),
                Paths.get(properties.getExtractor().getInstallDir()),
                PlatformBinary.current().orElse(null),
                Duration.ofSeconds(properties.getExtractor().getDownloadTimeoutSeconds()));
    }

    FallbackBinaryInstaller(OkHttpClient proxiedClient, OkHttpClient directClient, String downloadBaseUrl,
                            Path installDir, String assetName, Duration downloadTimeout) {
        this.proxiedClient = proxiedClient != null
                ? proxiedClient.newBuilder().callTimeout(downloadTimeout).build()
                : null;
        this.directClient = directClient.newBuilder().callTimeout(downloadTimeout).build();
        this.downloadBaseUrl = downloadBaseUrl;
        this.installDir = installDir;
        this.assetName = assetName;
    }

    /**
     * Return the path of an installed, executable fallback binary, downloading it if needed.
     *
     * @throws BinaryDownloadException if the platform is unsupported or the download fails
     */
    public Path ensureInstalled() {
        while (true) {
            CompletableFuture<Path> current = installation.get();
            if (current != null) {
                return await(current);
            }

            CompletableFuture<Path> mine = new CompletableFuture<>();
            if (!installation.compareAndSet(null, mine)) {
                continue;
            }

            try {
                Path path = install();
                mine.complete(path);
                return path;
            } catch (RuntimeException | Error e) {
                installation.compareAndSet(mine, null);
                mine.completeExceptionally(e);
                throw e;
            }
        }
    }

    private Path install() {
        if (assetName == null) {
            throw new BinaryDownloadException("Unsupported platform for yt-dlp binary ("
                    + System.getProperty("os.name") + "/" + System.getProperty("os.arch") + ")", null);
        }

        Path target = installDir.resolve(assetName);
        if (Files.isRegularFile(target)) {
            log.info("Using previously installed fallback binary: {}", target);
            makeExecutable(target);
            return target;
        }

        String url = downloadBaseUrl + "/" + assetName;
        log.info("Downloading fallback yt-dlp binary from {}", url);

        if (proxiedClient == null) {
            return downloadTo(directClient, url, target);
        }

        try {
            return downloadTo(proxiedClient, url, target);
        } catch (BinaryDownloadException e) {
            log.warn("Proxied download of yt-dlp failed ({}), retrying direct", e.getMessage());
            return downloadTo(directClient, url, target);
        }
    }

    private Path downloadTo(OkHttpClient client, String url, Path target) {
        Request request = new Request.Builder().url(url).build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new BinaryDownloadException("Failed to download yt-dlp (" + response.code() + ")",
                        url, response.code());
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new BinaryDownloadException("Failed to download yt-dlp (empty body)", url);
            }

            Files.createDirectories(installDir);
            Path partial = Files.createTempFile(installDir, assetName, ".part");
            try {
                long size;
                try (InputStream in = body.byteStream()) {
                    size = Files.copy(in, partial, StandardCopyOption.REPLACE_EXISTING);
                }
                makeExecutable(partial);
                moveIntoPlace(partial, target);
                log.info("Installed fallback yt-dlp binary ({} bytes) at {}", size, target);
                return target;
            } finally {
                Files.deleteIfExists(partial);
            }
        } catch (IOException e) {
            throw new BinaryDownloadException("Failed to download yt-dlp: " + e.getMessage(), e, url);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void makeExecutable(Path file) {
        try {
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
            } else if (!file.toFile().setExecutable(true, false)) {
                log.warn("Could not mark {} executable", file);
            }
        } catch (IOException e) {
            throw new BinaryDownloadException("Failed to make yt-dlp executable: " + e.getMessage(), e,
                    file.toString());
        }
    }

    private Path await(CompletableFuture<Path> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BinaryDownloadException("Interrupted while waiting for yt-dlp download", e, null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BinaryDownloadException) {
                throw (BinaryDownloadException) cause;
            }
            throw new BinaryDownloadException("Failed to download yt-dlp: " + cause.getMessage(), cause, null);
        }
    }
}
