package com.github.feedflow.service;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.exception.NoPlayableStreamException;
import com.github.feedflow.model.MediaKind;
import com.github.feedflow.model.ResolvedStream;
import com.github.feedflow.model.StreamResponse;
import com.github.feedflow.model.StreamType;
import com.github.feedflow.service.token.CapabilityTokenCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreamLinkService")
class StreamLinkServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String VIDEO_ID = "dQw4w9WgXcQ";

    @Mock
    private StreamResolutionService resolutionService;

    private StreamProxyProperties properties;
    private CapabilityTokenCodec codec;
    private StreamLinkService service;
    private final UriComponentsBuilder origin = UriComponentsBuilder.fromUriString("https://feeds.example.org");

    @BeforeEach
    void setUp() {
        properties = new StreamProxyProperties();
        properties.getStream().setTokenTtlSeconds(600);
        codec = new CapabilityTokenCodec("link-secret", 30);
        service = new StreamLinkService(resolutionService, codec, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ResolvedStream stream(String videoUrl, String audioUrl) {
        return ResolvedStream.builder()
                .videoId(VIDEO_ID)
                .videoUrl(videoUrl)
                .audioUrl(audioUrl)
                .title("Title")
                .thumbnailUrl("https://i.ytimg.com/x.jpg")
                .durationSeconds(99)
                .resolvedAt(NOW)
                .build();
    }

    @Test
    @DisplayName("should sign each kind with an expiry of now plus the TTL")
    void shouldSignEachKind() {
        when(resolutionService.resolve(VIDEO_ID)).thenReturn(stream("https://cdn/v", "https://cdn/a"));
        long exp = NOW.getEpochSecond() + 600;

        StreamResponse response = service.describe(VIDEO_ID, StreamType.BOTH, origin);

        assertEquals("https://feeds.example.org/api/youtube/proxy/" + VIDEO_ID + "?type=video&exp=" + exp
                + "&sig=" + codec.mint(VIDEO_ID, MediaKind.VIDEO, exp), response.getVideoUrl());
        assertEquals("https://feeds.example.org/api/youtube/proxy/" + VIDEO_ID + "?type=audio&exp=" + exp
                + "&sig=" + codec.mint(VIDEO_ID, MediaKind.AUDIO, exp), response.getAudioUrl());
        assertEquals("Title", response.getTitle());
        assertEquals(99, response.getDuration());
    }

    @Test
    @DisplayName("should omit kinds that were not requested")
    void shouldOmitUnrequestedKinds() {
        when(resolutionService.resolve(VIDEO_ID)).thenReturn(stream("https://cdn/v", "https://cdn/a"));

        StreamResponse response = service.describe(VIDEO_ID, StreamType.VIDEO, origin);

        assertNotNull(response.getVideoUrl());
        assertNull(response.getAudioUrl());
    }

    @Test
    @DisplayName("should fail when the requested kind has no stream")
    void shouldFailWithoutRequestedKind() {
        when(resolutionService.resolve(VIDEO_ID)).thenReturn(stream(null, "https://cdn/a"));

        assertThrows(NoPlayableStreamException.class, () -> service.describe(VIDEO_ID, StreamType.VIDEO, origin));
    }

    @Test
    @DisplayName("should leave the origin builder untouched")
    void shouldNotMutateOrigin() {
        when(resolutionService.resolve(VIDEO_ID)).thenReturn(stream("https://cdn/v", "https://cdn/a"));

        service.describe(VIDEO_ID, StreamType.BOTH, origin);

        assertEquals("https://feeds.example.org", origin.toUriString());
    }
}
