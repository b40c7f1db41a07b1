package com.reqsafe.idempotency;

import com.reqsafe.common.ErrorKind;

/**
 * The key was already used for a request with different content.
 */
public class IdempotencyKeyReuseException extends IdempotencyException {

    public IdempotencyKeyReuseException(String scope, String key) {
        super(ErrorKind.IDEMPOTENCY_KEY_REUSE, scope, key,
            "Idempotency key '" + key + "' was already used with a different request in scope " + scope);
    }
}
