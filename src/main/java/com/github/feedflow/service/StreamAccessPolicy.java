package com.github.feedflow.service;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.exception.StreamAccessDeniedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Decides whether a caller may mint proxy URLs on /stream.
 * Open when neither a signing secret nor an access token is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamAccessPolicy {

    public static final String ACCESS_TOKEN_HEADER = "X-FeedFlow-Stream-Token";

    private final StreamProxyProperties properties;
    private final ObjectProvider<StreamRequestAuthenticator> authenticators;

    public void authorize(HttpServletRequest request) {
        StreamProxyProperties.Stream stream = properties.getStream();
        if (!stream.isSigningEnabled() && !stream.isAccessTokenConfigured()) {
            return;
        }

        if (stream.isAccessTokenConfigured() && matchesAccessToken(request.getHeader(ACCESS_TOKEN_HEADER))) {
            return;
        }

        boolean authenticated = authenticators.orderedStream()
                .anyMatch(authenticator -> authenticator.isAuthenticated(request));
        if (!authenticated) {
            log.warn("Rejected unauthenticated stream request: {}", request.getRequestURI());
            throw new StreamAccessDeniedException();
        }
    }

    private boolean matchesAccessToken(String provided) {
        if (provided == null || provided.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8),
                properties.getStream().getAccessToken().getBytes(StandardCharsets.UTF_8));
    }
}
