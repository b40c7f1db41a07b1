package com.reqsafe.idempotency;

/**
 * What a second caller does while the first one is still running the operation.
 */
public enum ConflictPolicy {
    /** Wait for the owner's outcome, up to the configured wait timeout. */
    BLOCK,
    /** Fail right away with {@link IdempotencyInProgressException}. */
    REJECT
}
