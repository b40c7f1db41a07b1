package com.reqsafe.idempotency;

import com.reqsafe.common.ErrorKind;

/**
 * Gave up waiting for another caller's run of the same key. Safe to retry later.
 */
public class IdempotencyConflictException extends IdempotencyException {

    public IdempotencyConflictException(String scope, String key, String message) {
        super(ErrorKind.IDEMPOTENCY_CONFLICT, scope, key, message);
    }

    public IdempotencyConflictException(String scope, String key, String message, Throwable cause) {
        super(ErrorKind.IDEMPOTENCY_CONFLICT, scope, key, message, cause);
    }
}
