package io.jobwarden.monitor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Holds the shared secret that grants read access to the monitoring endpoints.
 */
public interface MonitoringTokenStore {

    Optional<String> currentToken();

    /**
     * Replace the current token with a freshly generated one.
     *
     * @return the new token
     */
    String rotate();

    /**
     * Constant-time comparison against the current token. Blank candidates never match.
     */
    default boolean matches(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        return currentToken()
                .map(token -> MessageDigest.isEqual(
                        token.getBytes(StandardCharsets.UTF_8),
                        candidate.getBytes(StandardCharsets.UTF_8)))
                .orElse(false);
    }
}
