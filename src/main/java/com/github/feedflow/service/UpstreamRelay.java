package com.github.feedflow.service;

import com.github.feedflow.model.MediaKind;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open upstream media response waiting to be copied to the client.
 * <p>
 * Owns the OkHttp call until {@link #close()}: either the body is written out, the client goes away,
 * or the request completes without the body ever being written (async submit rejected).
 */
@Slf4j
public class UpstreamRelay implements StreamingResponseBody, Closeable {

    static final int BUFFER_SIZE = 64 * 1024;

    private final Call call;
    private final Response upstream;

    @Getter
    private final String videoId;

    @Getter
    private final MediaKind kind;

    @Getter
    private final int status;

    @Getter
    private final HttpHeaders headers;

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean completed;

    UpstreamRelay(Call call, Response upstream, String videoId, MediaKind kind, HttpHeaders headers) {
        this.call = call;
        this.upstream = upstream;
        this.videoId = videoId;
        this.kind = kind;
        this.status = upstream.code();
        this.headers = headers;
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        try {
            ResponseBody body = upstream.body();
            if (body == null) {
                return;
            }
            try (InputStream in = body.byteStream()) {
                copy(in, out);
            }
            completed = true;
        } catch (IOException e) {
            // Usually the player closed the connection while seeking; stop pulling from upstream
            call.cancel();
            log.debug("Proxy stream for {} {} ended early: {}", videoId, kind.getWireName(), e.getMessage());
            throw e;
        } finally {
            close();
        }
    }

    /**
     * Releases the upstream connection, cancelling the call unless the body was relayed in full.
     * Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!completed) {
            call.cancel();
        }
        upstream.close();
    }

    public boolean isClosed() {
        return closed.get();
    }

    boolean isCanceled() {
        return call.isCanceled();
    }

    private static void copy(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
        }
        out.flush();
    }
}
