package com.github.feedflow.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kinds a client asks for on /stream.
 */
public enum StreamType {
    VIDEO(EnumSet.of(MediaKind.VIDEO)),
    AUDIO(EnumSet.of(MediaKind.AUDIO)),
    BOTH(EnumSet.of(MediaKind.VIDEO, MediaKind.AUDIO));

    private final Set<MediaKind> kinds;

    StreamType(Set<MediaKind> kinds) {
        this.kinds = kinds;
    }

    public boolean includes(MediaKind kind) {
        return kinds.contains(kind);
    }

    public static Optional<StreamType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
