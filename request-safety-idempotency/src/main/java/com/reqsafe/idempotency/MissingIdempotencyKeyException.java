package com.reqsafe.idempotency;

import com.reqsafe.common.ErrorKind;

public class MissingIdempotencyKeyException extends IdempotencyException {

    public MissingIdempotencyKeyException(String scope) {
        super(ErrorKind.MISSING_IDEMPOTENCY_KEY, scope, null, "Idempotency key is required in scope " + scope);
    }
}
