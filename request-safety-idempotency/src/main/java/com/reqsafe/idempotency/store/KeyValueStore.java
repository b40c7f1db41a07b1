package com.reqsafe.idempotency.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value store backing the idempotency guard.
 * Implement this over Redis, a database table, etc.; the store may be remote and shared by many processes.
 *
 * <p>{@link #createIfAbsent} and {@link #compareAndSet} must each be a single atomic operation on the store.
 * Expired entries must behave as absent. Transport failures are reported as {@link StoreUnavailableException}.
 */
public interface KeyValueStore {

    /**
     * @return true if the value was written, false if a live entry already existed
     */
    boolean createIfAbsent(String key, String value, Duration ttl);

    Optional<String> get(String key);

    /**
     * Replaces the value and resets its TTL only if the current value equals {@code expected}.
     *
     * @return true if the swap happened
     */
    boolean compareAndSet(String key, String expected, String newValue, Duration ttl);

    void delete(String key);
}
