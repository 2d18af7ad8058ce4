package com.supportsignal.session.util;

import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

import com.supportsignal.session.config.SessionPolicyProperties;

/**
 * Generates opaque session tokens and correlation ids.
 *
 * Formats:
 * - session token: 64 lowercase hex chars (32 random bytes)
 * - impersonation token: reserved prefix + 64 hex chars
 * - correlation id: 32 lowercase hex chars (16 random bytes)
 *
 * Correlation ids are safe to log; tokens are not.
 */
@Component
public class TokenGenerator {

    public static final int TOKEN_BYTES = 32;
    public static final int CORRELATION_ID_BYTES = 16;
    public static final int TOKEN_LENGTH = TOKEN_BYTES * 2;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final String impersonationPrefix;

    public TokenGenerator(SessionPolicyProperties properties) {
        this.impersonationPrefix = properties.getImpersonation().getTokenPrefix();
    }

    public String newSessionToken() {
        return randomHex(TOKEN_BYTES);
    }

    public String newImpersonationToken() {
        return impersonationPrefix + randomHex(TOKEN_BYTES);
    }

    public String newCorrelationId() {
        return randomHex(CORRELATION_ID_BYTES);
    }

    /**
     * Masks a token for logging: first 8 chars only.
     *
     * @param token raw token, possibly null or attacker-controlled
     * @return masked form, never the full token
     */
    public static String mask(String token) {
        if (token == null || token.length() < 12) {
            return "INVALID";
        }
        return token.substring(0, 8) + "...";
    }

    /**
     * Normalizes a presented token for store lookups. Null and values the
     * store cannot hold (NUL characters) become the empty string, which
     * matches nothing.
     *
     * @param token raw token, possibly null or attacker-controlled
     * @return lookup key, never null
     */
    public static String normalize(String token) {
        if (token == null || token.indexOf('\0') >= 0) {
            return "";
        }
        return token;
    }

    private static String randomHex(int bytes) {
        byte[] randomBytes = new byte[bytes];
        SECURE_RANDOM.nextBytes(randomBytes);
        return HEX.formatHex(randomBytes);
    }
}
