package com.reqsafe.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reqsafe.idempotency.store.KeyValueStore;
import com.reqsafe.idempotency.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs a side-effecting operation at most once per {@code (scope, key)} across every process sharing
 * the same {@link KeyValueStore}.
 *
 * <p>The first caller claims the key by creating an {@code IN_PROGRESS} record, runs the operation and
 * swaps the record to {@code COMPLETED} or {@code FAILED}. Later callers replay whatever the record says.
 * A caller arriving while the record is still {@code IN_PROGRESS} is handled by the {@link ConflictPolicy}.
 *
 * <p>All coordination goes through the store's atomic create and compare-and-set; the guard holds no
 * locks and keeps no state between calls, so one instance can serve any number of threads.
 */
@Slf4j
public class IdempotencyGuard {

    private final KeyValueStore store;
    private final IdempotencyGuardConfig config;
    private final Clock clock;
    private final ObjectMapper resultMapper;
    private final IdempotencyRecordCodec records = new IdempotencyRecordCodec();

    public IdempotencyGuard(KeyValueStore store) {
        this(store, new IdempotencyGuardConfig());
    }

    public IdempotencyGuard(KeyValueStore store, IdempotencyGuardConfig config) {
        this(store, config, Clock.systemUTC(), defaultResultMapper());
    }

    /**
     * @param resultMapper used by {@link #run(String, String, Duration, Class, IdempotentOperation)} to store results
     */
    public IdempotencyGuard(KeyValueStore store, IdempotencyGuardConfig config, Clock clock, ObjectMapper resultMapper) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.resultMapper = Objects.requireNonNull(resultMapper, "resultMapper");
        config.validate();
    }

    public IdempotencyGuardConfig config() {
        return config;
    }

    /**
     * Runs {@code operation} under {@code (scope, key)}, storing its result as JSON.
     *
     * @param ttl how long the outcome is remembered; {@code null} for the configured record TTL
     */
    public <T> T run(String scope, String key, Duration ttl, Class<T> type, IdempotentOperation<T> operation) {
        return run(IdempotencyRequest.of(scope, key), ttl, JacksonResultCodec.of(resultMapper, type), operation);
    }

    /**
     * Runs {@code operation} for {@code request} unless an earlier call with the same scope and key
     * already did, in which case that call's outcome is returned or rethrown.
     *
     * @throws MissingIdempotencyKeyException no key and the missing-key policy is {@code REJECT}
     * @throws IdempotencyInProgressException another caller is running it and the policy is {@code REJECT}
     * @throws IdempotencyConflictException waited past the wait timeout, or was interrupted while waiting
     * @throws IdempotencyKeyReuseException the key was first used with a different fingerprint
     * @throws IdempotentOperationException the operation threw a checked exception, or a recorded failure is replayed
     * @throws StoreUnavailableException the store failed
     */
    public <T> T run(IdempotencyRequest request, Duration ttl, ResultCodec<T> codec, IdempotentOperation<T> operation) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(operation, "operation");
        Duration recordTtl = ttl == null ? config.getRecordTtl() : ttl;
        IdempotencyGuardConfig.requirePositive("ttl", recordTtl);

        if (!request.hasKey()) {
            if (config.getMissingKeyPolicy() == MissingKeyPolicy.REJECT) {
                throw new MissingIdempotencyKeyException(request.scope());
            }
            log.debug("No idempotency key in scope {}, running unguarded", request.scope());
            return runUnguarded(request, operation);
        }

        String storageKey = storageKey(request);
        long deadline = System.nanoTime() + config.getWaitTimeout().toNanos();

        while (true) {
            IdempotencyRecord claim = IdempotencyRecord.inProgress(request.fingerprint(), clock.instant(), recordTtl);
            String claimJson = records.write(claim);
            if (store.createIfAbsent(storageKey, claimJson, recordTtl)) {
                log.debug("Claimed {}", storageKey);
                return runAsOwner(request, storageKey, claim, claimJson, recordTtl, codec, operation);
            }

            IdempotencyRecord existing = read(request, storageKey);
            while (existing != null && existing.status() == IdempotencyStatus.IN_PROGRESS) {
                if (config.getConflictPolicy() == ConflictPolicy.REJECT) {
                    log.debug("{} is in progress, rejecting duplicate", storageKey);
                    throw new IdempotencyInProgressException(request.scope(), request.key());
                }
                pause(request, storageKey, deadline);
                existing = read(request, storageKey);
            }
            if (existing != null) {
                return replay(request, storageKey, existing, codec);
            }
            // expired between our create attempt and the read
            log.debug("{} disappeared, claiming again", storageKey);
            if (System.nanoTime() - deadline >= 0) {
                throw timedOut(request, storageKey);
            }
        }
    }

    /**
     * {@code prefix:scope:sha256(key)}. The hash is fixed-length hex without separators, so a scope or
     * key containing ':' can never make two different pairs land on the same record.
     */
    String storageKey(IdempotencyRequest request) {
        return config.getKeyPrefix() + ":" + request.scope() + ":" + DigestUtils.sha256Hex(request.key());
    }

    private <T> T runAsOwner(IdempotencyRequest request,
                             String storageKey,
                             IdempotencyRecord claim,
                             String claimJson,
                             Duration recordTtl,
                             ResultCodec<T> codec,
                             IdempotentOperation<T> operation) {
        T result;
        try {
            result = operation.execute();
        } catch (Exception e) {
            Duration failureTtl = config.getFailureTtl().compareTo(recordTtl) < 0 ? config.getFailureTtl() : recordTtl;
            recordFailure(storageKey, claim, claimJson, failureTtl, e);
            throw propagate(request, e);
        }

        byte[] payload;
        try {
            payload = codec.encode(result);
        } catch (RuntimeException e) {
            // the effect has happened; keep the failure as long as a result would be kept so it never runs again
            recordFailure(storageKey, claim, claimJson, recordTtl, e);
            throw new IdempotentOperationException(request.scope(), request.key(),
                "Operation ran but its result could not be stored", e);
        }

        String completed = records.write(claim.completed(payload, recordTtl));
        if (store.compareAndSet(storageKey, claimJson, completed, recordTtl)) {
            log.info("Completed {}, result kept for {}", storageKey, recordTtl);
        } else {
            log.warn("Record {} changed while the operation ran; result not stored", storageKey);
        }
        return result;
    }

    private void recordFailure(String storageKey, IdempotencyRecord claim, String claimJson, Duration failureTtl, Exception e) {
        String failed = records.write(claim.failed(e.getClass().getName(), e.getMessage(), failureTtl));
        try {
            if (store.compareAndSet(storageKey, claimJson, failed, failureTtl)) {
                log.warn("Operation under {} failed with {}; failure kept for {}", storageKey, e.getClass().getName(), failureTtl);
            } else {
                log.warn("Operation under {} failed with {}, but the record changed while it ran; failure not stored",
                    storageKey, e.getClass().getName());
            }
        } catch (StoreUnavailableException storeFailure) {
            e.addSuppressed(storeFailure);
            log.warn("Could not record failure for {}", storageKey, storeFailure);
        }
    }

    private <T> T replay(IdempotencyRequest request, String storageKey, IdempotencyRecord record, ResultCodec<T> codec) {
        if (record.status() == IdempotencyStatus.FAILED) {
            log.debug("Replaying recorded failure for {}", storageKey);
            throw new IdempotentOperationException(request.scope(), request.key(), record.errorType(), record.errorMessage());
        }
        log.debug("Replaying stored result for {}", storageKey);
        return codec.decode(record.result());
    }

    private IdempotencyRecord read(IdempotencyRequest request, String storageKey) {
        Optional<String> json = store.get(storageKey);
        if (json.isEmpty()) {
            return null;
        }
        IdempotencyRecord record = records.read(storageKey, json.get());
        if (request.fingerprint() != null && record.fingerprint() != null
            && !request.fingerprint().equals(record.fingerprint())) {
            throw new IdempotencyKeyReuseException(request.scope(), request.key());
        }
        return record;
    }

    private void pause(IdempotencyRequest request, String storageKey, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw timedOut(request, storageKey);
        }
        try {
            TimeUnit.NANOSECONDS.sleep(Math.min(remaining, config.getPollInterval().toNanos()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdempotencyConflictException(request.scope(), request.key(),
                "Interrupted while waiting for " + storageKey, e);
        }
    }

    private IdempotencyConflictException timedOut(IdempotencyRequest request, String storageKey) {
        return new IdempotencyConflictException(request.scope(), request.key(),
            "Gave up after " + config.getWaitTimeout() + " waiting for " + storageKey);
    }

    private <T> T runUnguarded(IdempotencyRequest request, IdempotentOperation<T> operation) {
        try {
            return operation.execute();
        } catch (Exception e) {
            throw propagate(request, e);
        }
    }

    private static RuntimeException propagate(IdempotencyRequest request, Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return new IdempotentOperationException(request.scope(), request.key(), e);
    }

    private static ObjectMapper defaultResultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
