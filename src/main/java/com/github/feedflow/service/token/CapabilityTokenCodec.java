package com.github.feedflow.service.token;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.model.MediaKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Base64;

/**
 * Signs and checks stateless capability tokens for the media proxy.
 * <p>
 * A token grants playback of one (video, kind) pair until {@code exp}; it carries no user identity.
 * The signature is Base64URL (unpadded) HMAC-SHA256 over {@code videoId.kind.exp}.
 * Without a signing secret the codec is disabled and the proxy runs open.
 */
@Slf4j
@Component
public class CapabilityTokenCodec {

    static final String ALGORITHM = "HmacSHA256";
    static final char DELIMITER = '.';

    private final SecretKeySpec key;
    private final long clockSkewSeconds;

    @Autowired
    public CapabilityTokenCodec(StreamProxyProperties properties) {
        this(properties.getStream().getSigningSecret(), properties.getStream().getClockSkewSeconds());
        if (!isEnabled()) {
            log.warn("No stream signing secret configured: /proxy accepts unsigned requests (open proxy mode)");
        }
    }

    public CapabilityTokenCodec(String secret, long clockSkewSeconds) {
        this.key = secret != null && !secret.isBlank()
                ? new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM)
                : null;
        this.clockSkewSeconds = clockSkewSeconds;
    }

    public boolean isEnabled() {
        return key != null;
    }

    public long getClockSkewSeconds() {
        return clockSkewSeconds;
    }

    public String mint(String videoId, MediaKind kind, long expiresAt) {
        if (!isEnabled()) {
            throw new IllegalStateException("Stream token signing is disabled");
        }
        byte[] digest = newMac().doFinal(canonical(videoId, kind, expiresAt).getBytes(StandardCharsets.UTF_8));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    }

    /**
     * Variant for raw query values; a non-numeric expiry is simply invalid.
     */
    public boolean verify(String videoId, MediaKind kind, String expiresAt, String signature) {
        Long exp = parseExpiry(expiresAt);
        return exp != null && verify(videoId, kind, exp, signature);
    }

    public boolean verify(String videoId, MediaKind kind, long expiresAt, String signature) {
        if (!isEnabled() || videoId == null || videoId.isEmpty() || kind == null
                || signature == null || signature.isEmpty()) {
            return false;
        }

        byte[] expected = mint(videoId, kind, expiresAt).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signature.getBytes(StandardCharsets.UTF_8);
        if (expected.length != actual.length) {
            return false;
        }
        return MessageDigest.isEqual(expected, actual);
    }

    /**
     * Expiry is a hard bound; the skew only extends acceptance just past it.
     */
    public boolean isUnexpired(long expiresAt, Instant now) {
        return now.getEpochSecond() - clockSkewSeconds <= expiresAt;
    }

    public static Long parseExpiry(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String canonical(String videoId, MediaKind kind, long expiresAt) {
        return videoId + DELIMITER + kind.getWireName() + DELIMITER + expiresAt;
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
