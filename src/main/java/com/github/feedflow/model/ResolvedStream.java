package com.github.feedflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Fully populated resolution of one video. Immutable; a newer resolution replaces it as a whole.
 */
@Value
@Builder
public class ResolvedStream {

    String videoId;
    String videoUrl;
    String audioUrl;
    String title;
    String thumbnailUrl;
    long durationSeconds;
    Instant resolvedAt;

    public String urlFor(MediaKind kind) {
        return kind == MediaKind.AUDIO ? audioUrl : videoUrl;
    }

    public boolean hasStream(MediaKind kind) {
        return urlFor(kind) != null;
    }

    @Override
    public String toString() {
        return "ResolvedStream(" + videoId + ", video=" + (videoUrl != null)
                + ", audio=" + (audioUrl != null) + ", resolvedAt=" + resolvedAt + ")";
    }
}
