package com.github.feedflow.service;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.exception.StreamNotFoundException;
import com.github.feedflow.exception.StreamTokenException;
import com.github.feedflow.exception.UpstreamFetchException;
import com.github.feedflow.model.MediaKind;
import com.github.feedflow.model.ResolvedStream;
import com.github.feedflow.service.token.CapabilityTokenCodec;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * Checks proxy capability tokens and relays upstream media bytes, range requests included.
 * The only place a resolved upstream URL is ever fetched.
 */
@Slf4j
@Service
public class MediaProxyService {

    private static final List<String> FORWARDED_HEADERS = List.of(
            HttpHeaders.CONTENT_LENGTH,
            HttpHeaders.CONTENT_RANGE,
            HttpHeaders.ACCEPT_RANGES);

    private final StreamResolutionService resolutionService;
    private final CapabilityTokenCodec tokenCodec;
    private final OkHttpClient upstreamHttpClient;
    private final StreamProxyProperties properties;
    private final Clock clock;

    public MediaProxyService(StreamResolutionService resolutionService,
                             CapabilityTokenCodec tokenCodec,
                             @Qualifier("upstreamHttpClient") OkHttpClient upstreamHttpClient,
                             StreamProxyProperties properties,
                             Clock clock) {
        this.resolutionService = resolutionService;
        this.tokenCodec = tokenCodec;
        this.upstreamHttpClient = upstreamHttpClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Token check for one proxy request. Skipped entirely when no signing secret is configured.
     *
     * @throws StreamTokenException on a missing, expired or invalid token
     */
    public void verifyToken(String videoId, MediaKind kind, String exp, String sig) {
        if (!tokenCodec.isEnabled()) {
            return;
        }

        if (exp == null || exp.isBlank() || sig == null || sig.isBlank()) {
            throw new StreamTokenException(StreamTokenException.Failure.MISSING);
        }

        Long expiresAt = CapabilityTokenCodec.parseExpiry(exp);
        if (expiresAt == null || !tokenCodec.isUnexpired(expiresAt, clock.instant())) {
            throw new StreamTokenException(StreamTokenException.Failure.EXPIRED);
        }

        if (!tokenCodec.verify(videoId, kind, expiresAt, sig)) {
            throw new StreamTokenException(StreamTokenException.Failure.INVALID);
        }
    }

    /**
     * Open the upstream stream for {@code kind}. The returned relay holds the upstream connection
     * and must be written out or closed by the caller.
     */
    public UpstreamRelay open(String videoId, MediaKind kind, String range) {
        ResolvedStream stream = resolutionService.resolve(videoId);
        String url = stream.urlFor(kind);
        if (url == null) {
            throw new StreamNotFoundException(videoId, kind);
        }

        Request.Builder request = new Request.Builder()
                .url(url)
                .header("User-Agent", properties.getStream().getUserAgent())
                // Keeps OkHttp from negotiating gzip, which would drop Content-Length and break ranges
                .header("Accept-Encoding", "identity");
        if (range != null && !range.isBlank()) {
            request.header(HttpHeaders.RANGE, range);
        }

        Call call = upstreamHttpClient.newCall(request.build());
        Response upstream;
        try {
            upstream = call.execute();
        } catch (IOException e) {
            log.error("Upstream fetch failed for {} {}: {}", videoId, kind.getWireName(), e.getMessage());
            throw new UpstreamFetchException("Failed to proxy stream", e, videoId);
        }

        if (!upstream.isSuccessful()) {
            log.warn("Upstream answered {} for {} {}", upstream.code(), videoId, kind.getWireName());
        } else {
            log.debug("Proxying {} {} (status={}, range={})", videoId, kind.getWireName(), upstream.code(), range);
        }

        return new UpstreamRelay(call, upstream, videoId, kind, responseHeaders(upstream, kind));
    }

    private HttpHeaders responseHeaders(Response upstream, MediaKind kind) {
        HttpHeaders headers = new HttpHeaders();

        String contentType = upstream.header(HttpHeaders.CONTENT_TYPE);
        headers.set(HttpHeaders.CONTENT_TYPE, contentType != null ? contentType : kind.getDefaultContentType());

        for (String name : FORWARDED_HEADERS) {
            String value = upstream.header(name);
            if (value != null) {
                headers.set(name, value);
            }
        }

        headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        headers.setCacheControl("no-cache");
        return headers;
    }
}
