package com.github.feedflow.model;

import java.util.Locale;
import java.util.Optional;

public enum MediaKind {
    VIDEO("video", "video/mp4"),
    AUDIO("audio", "audio/mp4");

    private final String wireName;
    private final String defaultContentType;

    MediaKind(String wireName, String defaultContentType) {
        this.wireName = wireName;
        this.defaultContentType = defaultContentType;
    }

    /**
     * Name used in query strings and in the signed token payload.
     */
    public String getWireName() {
        return wireName;
    }

    public String getDefaultContentType() {
        return defaultContentType;
    }

    public static Optional<MediaKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
