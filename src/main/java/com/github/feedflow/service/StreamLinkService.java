package com.github.feedflow.service;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.exception.NoPlayableStreamException;
import com.github.feedflow.model.MediaKind;
import com.github.feedflow.model.ResolvedStream;
import com.github.feedflow.model.StreamResponse;
import com.github.feedflow.model.StreamType;
import com.github.feedflow.service.token.CapabilityTokenCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;

/**
 * Builds the /stream payload: metadata plus one signed proxy URL per requested kind.
 * Raw upstream URLs never leave this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamLinkService {

    public static final String PROXY_PATH = "/api/youtube/proxy/{videoId}";

    private final StreamResolutionService resolutionService;
    private final CapabilityTokenCodec tokenCodec;
    private final StreamProxyProperties properties;
    private final Clock clock;

    public StreamResponse describe(String videoId, StreamType type, UriComponentsBuilder origin) {
        ResolvedStream stream = resolutionService.resolve(videoId);

        boolean wantVideo = type.includes(MediaKind.VIDEO) && stream.hasStream(MediaKind.VIDEO);
        boolean wantAudio = type.includes(MediaKind.AUDIO) && stream.hasStream(MediaKind.AUDIO);
        if (!wantVideo && !wantAudio) {
            throw new NoPlayableStreamException(videoId);
        }

        long expiresAt = clock.instant().getEpochSecond() + properties.getStream().getTokenTtlSeconds();

        StreamResponse response = StreamResponse.builder()
                .title(stream.getTitle())
                .duration(stream.getDurationSeconds())
                .thumbnailUrl(stream.getThumbnailUrl())
                .videoUrl(wantVideo ? proxyUrl(origin, videoId, MediaKind.VIDEO, expiresAt) : null)
                .audioUrl(wantAudio ? proxyUrl(origin, videoId, MediaKind.AUDIO, expiresAt) : null)
                .build();

        log.debug("Issued {} stream links for {} (exp={})", type, videoId, expiresAt);
        return response;
    }

    String proxyUrl(UriComponentsBuilder origin, String videoId, MediaKind kind, long expiresAt) {
        UriComponentsBuilder builder = origin.cloneBuilder()
                .path(PROXY_PATH)
                .queryParam("type", kind.getWireName());

        if (tokenCodec.isEnabled()) {
            builder.queryParam("exp", expiresAt)
                    .queryParam("sig", tokenCodec.mint(videoId, kind, expiresAt));
        }

        return builder.buildAndExpand(videoId).encode().toUriString();
    }
}
