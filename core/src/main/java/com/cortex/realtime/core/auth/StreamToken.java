package com.cortex.realtime.core.auth;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Signed bearer token presented by streaming clients in the {@code token} query parameter.
 * <p>
 * <b>Token format:</b> URL-safe base64 of {@code userId:issuedAt:hmac}
 * <ul>
 *   <li>{@code userId}: authenticated user, becomes the connection owner</li>
 *   <li>{@code issuedAt}: issue timestamp (epoch seconds)</li>
 *   <li>{@code hmac}: hex HMAC-SHA256 over {@code userId:issuedAt}</li>
 * </ul>
 * </p>
 * <p>
 * Tokens are minted by the authentication service with the same secret; this side only verifies.
 * </p>
 */
public final class StreamToken {
    private static final String DELIMITER = ":";

    private StreamToken() {
    }

    /**
     * Generates a token.
     *
     * @param userId   user identifier (must not contain ':')
     * @param issuedAt issue time
     * @param secret   HMAC secret shared across the cluster
     * @return URL-safe base64 token
     */
    public static String generate(String userId, Instant issuedAt, String secret) {
        if (userId == null || userId.isEmpty() || userId.contains(DELIMITER)) {
            throw new IllegalArgumentException("Invalid user id for token: " + userId);
        }
        String payload = userId + DELIMITER + issuedAt.getEpochSecond();
        String token = payload + DELIMITER + computeHmac(payload, secret);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Verifies a token and extracts the user id.
     *
     * @param token  token from the client
     * @param secret HMAC secret
     * @param ttl    maximum token age
     * @param now    current time
     * @return user id, or empty if malformed, forged or expired
     */
    public static Optional<String> verify(String token, String secret, Duration ttl, Instant now) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            String[] parts = decoded.split(DELIMITER);
            if (parts.length != 3) {
                return Optional.empty();
            }

            String userId = parts[0];
            long issuedAt = Long.parseLong(parts[1]);
            String payload = userId + DELIMITER + issuedAt;
            byte[] expected = computeHmac(payload, secret).getBytes(StandardCharsets.UTF_8);
            byte[] provided = parts[2].getBytes(StandardCharsets.UTF_8);

            if (!MessageDigest.isEqual(expected, provided)) {
                return Optional.empty();
            }
            if (now.getEpochSecond() - issuedAt > ttl.getSeconds()) {
                return Optional.empty();
            }
            return Optional.of(userId);
        } catch (IllegalArgumentException e) {
            // bad base64 or non-numeric timestamp
            return Optional.empty();
        }
    }

    private static String computeHmac(String data, String secret) {
        return Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8))
            .hashString(data, StandardCharsets.UTF_8)
            .toString();
    }
}
