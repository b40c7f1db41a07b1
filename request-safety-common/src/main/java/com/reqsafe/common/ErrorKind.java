package com.reqsafe.common;

/**
 * Distinguishable failure kinds surfaced by the token service and the idempotency guard.
 * Callers branch on these to choose between rejecting, re-authenticating and retrying.
 */
public enum ErrorKind {
    ENCODE,
    DECODE,
    MALFORMED_TOKEN,
    INVALID_SIGNATURE,
    EXPIRED,

    IDEMPOTENCY_CONFLICT,
    IDEMPOTENCY_IN_PROGRESS,
    MISSING_IDEMPOTENCY_KEY,
    IDEMPOTENCY_KEY_REUSE,
    OPERATION_FAILED,
    STORE_UNAVAILABLE;

    /**
     * @return true when the same request may succeed later without any change on the caller side
     */
    public boolean isRetryable() {
        return this == IDEMPOTENCY_CONFLICT
            || this == IDEMPOTENCY_IN_PROGRESS
            || this == STORE_UNAVAILABLE;
    }
}
