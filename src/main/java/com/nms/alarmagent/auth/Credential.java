package com.nms.alarmagent.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * One issued access/refresh token pair. Immutable; a refresh produces a new instance.
 */
public record Credential(
        String accessToken,
        String refreshToken,
        String tokenType,
        Instant issuedAt,
        long expiresInSeconds
) {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public Instant expiresAt() {
        return issuedAt.plusSeconds(expiresInSeconds);
    }

    /**
     * @param margin safety window before the advertised expiry in which the token is
     *               already treated as expired
     */
    public boolean isValidAt(Instant now, Duration margin) {
        return now.isBefore(expiresAt().minus(margin));
    }

    public String authorizationHeader() {
        return tokenType + " " + accessToken;
    }

    @Override
    public String toString() {
        return "Credential[accessToken=" + mask(accessToken)
                + ", tokenType=" + tokenType
                + ", issuedAt=" + issuedAt
                + ", expiresInSeconds=" + expiresInSeconds + "]";
    }

    static String mask(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 6 ? "***" : token.substring(0, 6) + "***";
    }
}
