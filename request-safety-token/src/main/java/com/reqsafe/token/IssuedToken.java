package com.reqsafe.token;

import java.time.Duration;
import java.time.Instant;

/**
 * A freshly encoded token together with its timestamps. {@code expiresAt} is null for non-expiring tokens.
 */
public record IssuedToken(String token, Instant issuedAt, Instant expiresAt) {

    public Duration lifetime() {
        return expiresAt == null ? null : Duration.between(issuedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "IssuedToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
