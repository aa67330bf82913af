package com.github.feedflow.service.extraction;

import java.util.Locale;
import java.util.Optional;

/**
 * Name of the self-contained yt-dlp release asset for an OS/architecture pair.
 */
public final class PlatformBinary {

    private PlatformBinary() {
    }

    public static Optional<String> current() {
        return forPlatform(System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
    }

    public static Optional<String> forPlatform(String osName, String osArch) {
        String os = osName.toLowerCase(Locale.ROOT);
        String arch = osArch.toLowerCase(Locale.ROOT);

        if (os.startsWith("windows")) {
            return Optional.of("yt-dlp.exe");
        }
        if (os.startsWith("mac") || os.startsWith("darwin")) {
            return Optional.of("yt-dlp_macos");
        }
        if (os.startsWith("linux")) {
            if (arch.equals("aarch64") || arch.equals("arm64")) {
                return Optional.of("yt-dlp_linux_aarch64");
            }
            return Optional.of("yt-dlp_linux");
        }
        return Optional.empty();
    }
}
