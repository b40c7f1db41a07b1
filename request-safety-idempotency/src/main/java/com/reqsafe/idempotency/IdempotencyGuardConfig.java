package com.reqsafe.idempotency;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings for {@link IdempotencyGuard}.
 *
 * <p>Both policies default to {@code REJECT}: a duplicate arriving mid-flight is told to come back
 * later instead of holding a thread, and a request without a key is refused rather than run unprotected.
 */
@Getter
@Setter
public class IdempotencyGuardConfig {

    public static final String PREFIX = "reqsafe.idempotency.";

    private Duration recordTtl = Duration.ofMinutes(5);
    private Duration failureTtl = Duration.ofMinutes(1);
    private ConflictPolicy conflictPolicy = ConflictPolicy.REJECT;
    private MissingKeyPolicy missingKeyPolicy = MissingKeyPolicy.REJECT;
    private Duration waitTimeout = Duration.ofSeconds(10);
    private Duration pollInterval = Duration.ofMillis(50);
    private String keyPrefix = "idempotency";
    private String headerName = IdempotencyKeyResolver.DEFAULT_HEADER;

    public IdempotencyKeyResolver keyResolver() {
        return new IdempotencyKeyResolver(headerName);
    }

    /**
     * Reads {@code reqsafe.idempotency.*} keys; absent keys keep their defaults.
     * TTLs are in seconds, wait timeout and poll interval in milliseconds.
     */
    public static IdempotencyGuardConfig fromProperties(Properties props) {
        IdempotencyGuardConfig config = new IdempotencyGuardConfig();
        String v;
        if ((v = prop(props, "record-ttl-seconds")) != null) {
            config.setRecordTtl(Duration.ofSeconds(Long.parseLong(v)));
        }
        if ((v = prop(props, "failure-ttl-seconds")) != null) {
            config.setFailureTtl(Duration.ofSeconds(Long.parseLong(v)));
        }
        if ((v = prop(props, "conflict-policy")) != null) {
            config.setConflictPolicy(ConflictPolicy.valueOf(v.toUpperCase(Locale.ROOT)));
        }
        if ((v = prop(props, "missing-key-policy")) != null) {
            config.setMissingKeyPolicy(MissingKeyPolicy.valueOf(v.toUpperCase(Locale.ROOT)));
        }
        if ((v = prop(props, "wait-timeout-ms")) != null) {
            config.setWaitTimeout(Duration.ofMillis(Long.parseLong(v)));
        }
        if ((v = prop(props, "poll-interval-ms")) != null) {
            config.setPollInterval(Duration.ofMillis(Long.parseLong(v)));
        }
        if ((v = prop(props, "key-prefix")) != null) {
            config.setKeyPrefix(v);
        }
        if ((v = prop(props, "header-name")) != null) {
            config.setHeaderName(v);
        }
        return config;
    }

    private static String prop(Properties props, String name) {
        String value = props.getProperty(PREFIX + name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    void validate() {
        requirePositive("recordTtl", recordTtl);
        requirePositive("failureTtl", failureTtl);
        requirePositive("waitTimeout", waitTimeout);
        requirePositive("pollInterval", pollInterval);
        if (conflictPolicy == null || missingKeyPolicy == null) {
            throw new IllegalArgumentException("conflictPolicy and missingKeyPolicy are required");
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("keyPrefix must not be blank");
        }
    }

    static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + d);
        }
    }
}
