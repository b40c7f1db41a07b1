package com.reqsafe.idempotency;

import com.reqsafe.common.ErrorKind;

public class IdempotencyInProgressException extends IdempotencyException {

    public IdempotencyInProgressException(String scope, String key) {
        super(ErrorKind.IDEMPOTENCY_IN_PROGRESS, scope, key,
            "Request with idempotency key '" + key + "' is already being processed in scope " + scope);
    }
}
