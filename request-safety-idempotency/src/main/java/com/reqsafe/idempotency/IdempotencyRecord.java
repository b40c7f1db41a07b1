package com.reqsafe.idempotency;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * What the guard keeps in the store for one {@code (scope, key)}.
 *
 * <p>Moves {@code IN_PROGRESS -> COMPLETED} or {@code IN_PROGRESS -> FAILED} and nothing else;
 * terminal records are only ever removed by their TTL.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdempotencyRecord(
    IdempotencyStatus status,
    String fingerprint,
    byte[] result,
    String errorType,
    String errorMessage,
    Instant createdAt,
    Duration ttl
) {

    public IdempotencyRecord {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static IdempotencyRecord inProgress(String fingerprint, Instant now, Duration ttl) {
        return new IdempotencyRecord(IdempotencyStatus.IN_PROGRESS, fingerprint, null, null, null, now, ttl);
    }

    public IdempotencyRecord completed(byte[] payload, Duration newTtl) {
        requireInProgress(IdempotencyStatus.COMPLETED);
        return new IdempotencyRecord(IdempotencyStatus.COMPLETED, fingerprint, payload, null, null, createdAt, newTtl);
    }

    public IdempotencyRecord failed(String type, String message, Duration newTtl) {
        requireInProgress(IdempotencyStatus.FAILED);
        return new IdempotencyRecord(IdempotencyStatus.FAILED, fingerprint, null, type, message, createdAt, newTtl);
    }

    private void requireInProgress(IdempotencyStatus target) {
        if (status != IdempotencyStatus.IN_PROGRESS) {
            throw new IllegalStateException("Cannot move record from " + status + " to " + target);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdempotencyRecord that)) return false;
        return status == that.status
            && Objects.equals(fingerprint, that.fingerprint)
            && Arrays.equals(result, that.result)
            && Objects.equals(errorType, that.errorType)
            && Objects.equals(errorMessage, that.errorMessage)
            && createdAt.equals(that.createdAt)
            && Objects.equals(ttl, that.ttl);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(status, fingerprint, errorType, errorMessage, createdAt, ttl);
        return 31 * h + Arrays.hashCode(result);
    }

    @Override
    public String toString() {
        return "IdempotencyRecord[status=" + status
            + ", createdAt=" + createdAt
            + ", ttl=" + ttl
            + (errorType == null ? "" : ", errorType=" + errorType)
            + "]";
    }
}
