package com.reqsafe.idempotency;

import com.reqsafe.common.ErrorKind;

/**
 * The guarded operation failed. Either a checked exception from this caller's own run or a result
 * that could not be encoded for storage ({@link #isReplayed()} false, cause set), or a failure recorded by an earlier run and
 * replayed to this caller ({@link #isReplayed()} true, no cause).
 */
public class IdempotentOperationException extends IdempotencyException {

    private final String errorType;
    private final boolean replayed;

    public IdempotentOperationException(String scope, String key, Exception cause) {
        super(ErrorKind.OPERATION_FAILED, scope, key,
            "Operation failed: " + cause.getClass().getName() + ": " + cause.getMessage(), cause);
        this.errorType = cause.getClass().getName();
        this.replayed = false;
    }

    public IdempotentOperationException(String scope, String key, String message, Exception cause) {
        super(ErrorKind.OPERATION_FAILED, scope, key, message + ": " + cause.getClass().getName() + ": " + cause.getMessage(), cause);
        this.errorType = cause.getClass().getName();
        this.replayed = false;
    }

    public IdempotentOperationException(String scope, String key, String errorType, String errorMessage) {
        super(ErrorKind.OPERATION_FAILED, scope, key,
            "Operation previously failed: " + errorType + ": " + errorMessage);
        this.errorType = errorType;
        this.replayed = true;
    }

    public String getErrorType() {
        return errorType;
    }

    public boolean isReplayed() {
        return replayed;
    }
}
