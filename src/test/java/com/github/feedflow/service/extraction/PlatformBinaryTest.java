package com.github.feedflow.service.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlatformBinary")
class PlatformBinaryTest {

    @ParameterizedTest
    @CsvSource({
            "Windows 11, amd64, yt-dlp.exe",
            "Mac OS X, aarch64, yt-dlp_macos",
            "Mac OS X, x86_64, yt-dlp_macos",
            "Linux, amd64, yt-dlp_linux",
            "Linux, aarch64, yt-dlp_linux_aarch64",
            "Linux, arm64, yt-dlp_linux_aarch64"
    })
    @DisplayName("should map supported platforms to release assets")
    void shouldMapSupportedPlatforms(String os, String arch, String expected) {
        assertEquals(Optional.of(expected), PlatformBinary.forPlatform(os, arch));
    }

    @Test
    @DisplayName("should return empty for unsupported platforms")
    void shouldReturnEmptyForUnsupported() {
        assertTrue(PlatformBinary.forPlatform("SunOS", "sparcv9").isEmpty());
        assertTrue(PlatformBinary.forPlatform("FreeBSD", "amd64").isEmpty());
    }
}
