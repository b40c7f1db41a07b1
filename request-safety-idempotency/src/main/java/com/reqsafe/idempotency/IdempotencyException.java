package com.reqsafe.idempotency;

import com.reqsafe.common.ErrorKind;
import com.reqsafe.common.RequestSafetyException;

/**
 * Raised by {@link IdempotencyGuard} about one {@code (scope, key)}.
 */
public abstract class IdempotencyException extends RequestSafetyException {

    private final String scope;
    private final String key;

    protected IdempotencyException(ErrorKind kind, String scope, String key, String message) {
        super(kind, message);
        this.scope = scope;
        this.key = key;
    }

    protected IdempotencyException(ErrorKind kind, String scope, String key, String message, Throwable cause) {
        super(kind, message, cause);
        this.scope = scope;
        this.key = key;
    }

    public String getScope() {
        return scope;
    }

    public String getKey() {
        return key;
    }
}
