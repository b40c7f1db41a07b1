package com.reqsafe.idempotency;

public enum MissingKeyPolicy {
    /** Run the operation unguarded. */
    IGNORE,
    /** Throw {@link MissingIdempotencyKeyException}. */
    REJECT
}
