package com.supportsignal.session.util;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Reads the session token a client sent with a request.
 *
 * X-Session-Token wins over a Bearer Authorization header.
 */
public final class RequestTokens {

    public static final String SESSION_TOKEN_HEADER = "X-Session-Token";
    private static final String BEARER_PREFIX = "Bearer ";

    private RequestTokens() {
    }

    /**
     * @param request the HTTP request
     * @return the raw token, or null when none was sent
     */
    public static String extract(HttpServletRequest request) {
        String header = request.getHeader(SESSION_TOKEN_HEADER);
        if (StringUtils.hasText(header)) {
            return header.trim();
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(authorization) && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    /**
     * Like {@link #extract} but never null, so lookups report "not found".
     */
    public static String extractOrEmpty(HttpServletRequest request) {
        String token = extract(request);
        return token != null ? token : "";
    }
}
