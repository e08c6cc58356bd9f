package com.mcpgate.mcp.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Verifies the shared auth token presented by clients.
 * Both sides are hashed to a fixed length before a constant-time comparison, so neither
 * the length of the candidate nor the length of a matching prefix affects timing.
 */
public class Authenticator {
    private final boolean authEnabled;
    private final byte[] expectedDigest;

    public Authenticator(boolean authEnabled, String authToken) {
        if (authEnabled && (authToken == null || authToken.isEmpty())) {
            throw new IllegalArgumentException("An auth token is required when authentication is enabled");
        }
        this.authEnabled = authEnabled;
        this.expectedDigest = authEnabled ? digest(authToken) : null;
    }

    /**
     * @return true if authentication is disabled, otherwise whether the token matches
     */
    public boolean verifyToken(String token) {
        if (!authEnabled) {
            return true;
        }
        if (token == null) {
            return false;
        }
        return MessageDigest.isEqual(expectedDigest, digest(token));
    }

    public boolean isAuthEnabled() {
        return authEnabled;
    }

    private static byte[] digest(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
