package com.reqsafe.idempotency;

/**
 * One guarded invocation: the namespace it runs in, the client's key, and an optional fingerprint
 * of the request content.
 *
 * @param key may be null or blank; the guard then applies its missing-key policy
 */
public record IdempotencyRequest(String scope, String key, String fingerprint) {

    public IdempotencyRequest {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
    }

    public static IdempotencyRequest of(String scope, String key) {
        return new IdempotencyRequest(scope, key, null);
    }

    /**
     * Scopes the key to one operation and one caller, so two clients sending the same key never collide.
     * The scope is {@code operation:callerId}; the operation name may not contain ':' so the split is unique.
     */
    public static IdempotencyRequest forCaller(String operation, String callerId, String key, String fingerprint) {
        if (operation == null || operation.isBlank() || operation.indexOf(':') >= 0) {
            throw new IllegalArgumentException("operation must be a non-blank name without ':', got " + operation);
        }
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("callerId must not be blank");
        }
        return new IdempotencyRequest(operation + ":" + callerId, key, fingerprint);
    }

    public static IdempotencyRequest forCaller(String operation, String callerId, String key) {
        return forCaller(operation, callerId, key, null);
    }

    public boolean hasKey() {
        return key != null && !key.isBlank();
    }

    public IdempotencyRequest withFingerprint(String fingerprint) {
        return new IdempotencyRequest(scope, key, fingerprint);
    }
}
