package com.github.feedflow.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "feedflow")
public class StreamProxyProperties {

    private Stream stream = new Stream();
    private Cache cache = new Cache();
    private Extractor extractor = new Extractor();
    private Network network = new Network();

    @Data
    public static class Stream {
        /**
         * HMAC secret for proxy URLs. When blank, /proxy runs unauthenticated.
         */
        private String signingSecret;

        /**
         * Shared token accepted in the X-FeedFlow-Stream-Token header of /stream.
         */
        private String accessToken;

        @Min(1)
        private long tokenTtlSeconds = 21600;

        @Min(0)
        private long clockSkewSeconds = 30;

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

        @Min(1)
        private int connectTimeoutSeconds = 15;

        @Min(1)
        private int readTimeoutSeconds = 60;

        public boolean isSigningEnabled() {
            return signingSecret != null && !signingSecret.isBlank();
        }

        public boolean isAccessTokenConfigured() {
            return accessToken != null && !accessToken.isBlank();
        }
    }

    @Data
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofHours(5);

        @Min(1000)
        private long sweepIntervalMs = 3_600_000L;
    }

    @Data
    public static class Extractor {
        @NotBlank
        private String binary = "yt-dlp";

        @NotBlank
        private String watchUrlPrefix = "https://www.youtube.com/watch?v=";

        @Min(1)
        private int timeoutSeconds = 90;

        @Min(1)
        private int socketTimeoutSeconds = 15;

        @Min(0)
        private int retries = 2;

        private String cookiesPath;

        @NotBlank
        private String downloadBaseUrl = "https://github.com/yt-dlp/yt-dlp/releases/latest/download";

        @NotBlank
        private String installDir = System.getProperty("java.io.tmpdir") + "/feedflow";

        @Min(1)
        private int downloadTimeoutSeconds = 60;

        public boolean hasCookies() {
            return cookiesPath != null && !cookiesPath.isBlank();
        }

        public String getNormalizedDownloadBaseUrl() {
            return downloadBaseUrl.trim().replaceAll("/+$", "");
        }
    }

    @Data
    public static class Network {
        /**
         * Outbound proxy for regions where the upstream is only reachable through one.
         */
        private String proxyUrl;

        public boolean isProxyConfigured() {
            return proxyUrl != null && !proxyUrl.isBlank();
        }
    }
}
