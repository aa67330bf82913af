package com.github.feedflow.service;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Hook for the application's own user authentication (sessions, JWT).
 * Any registered bean that accepts a request allows it to mint proxy URLs.
 */
public interface StreamRequestAuthenticator {

    boolean isAuthenticated(HttpServletRequest request);
}
