package com.reqsafe.token;

import lombok.Builder;
import lombok.Singular;

import java.time.Instant;
import java.util.*;

/**
 * Claims carried by a token: the reserved {@code sub}, {@code iat} and {@code exp} as typed fields,
 * everything else in an insertion-ordered extension map.
 *
 * <p>Custom values must be JSON-compatible (string, number, boolean, list, map or null).
 * This is checked when the bundle is encoded, not when it is built.
 */
@Builder(toBuilder = true)
public record ClaimsBundle(String subject, Instant issuedAt, Instant expiresAt, @Singular("claim") Map<String, Object> custom) {

    public static final String SUBJECT = "sub";
    public static final String ISSUED_AT = "iat";
    public static final String EXPIRES_AT = "exp";

    /** Names held as typed fields; they may not appear in {@link #custom()}. */
    public static final Set<String> RESERVED = Set.of(SUBJECT, ISSUED_AT, EXPIRES_AT);

    public ClaimsBundle {
        custom = custom == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(custom));
    }

    /**
     * Splits a flat claims map into typed and custom claims. {@code iat}/{@code exp} may be given as
     * epoch seconds, {@link Instant} or {@link Date}.
     */
    public static ClaimsBundle of(Map<String, ?> claims) {
        Objects.requireNonNull(claims, "claims");
        Map<String, Object> custom = new LinkedHashMap<>();
        String subject = null;
        Instant issuedAt = null;
        Instant expiresAt = null;
        for (Map.Entry<String, ?> e : claims.entrySet()) {
            switch (e.getKey()) {
                case SUBJECT -> subject = e.getValue() == null ? null : e.getValue().toString();
                case ISSUED_AT -> issuedAt = toInstant(ISSUED_AT, e.getValue());
                case EXPIRES_AT -> expiresAt = toInstant(EXPIRES_AT, e.getValue());
                default -> custom.put(e.getKey(), normalize(e.getValue()));
            }
        }
        return new ClaimsBundle(subject, issuedAt, expiresAt, custom);
    }

    public Object get(String name) {
        return switch (name) {
            case SUBJECT -> subject;
            case ISSUED_AT -> issuedAt == null ? null : issuedAt.getEpochSecond();
            case EXPIRES_AT -> expiresAt == null ? null : expiresAt.getEpochSecond();
            default -> custom.get(name);
        };
    }

    public Optional<Instant> expiration() {
        return Optional.ofNullable(expiresAt);
    }

    /**
     * Flat view as it appears in the token payload, timestamps in epoch seconds.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (subject != null) out.put(SUBJECT, subject);
        if (issuedAt != null) out.put(ISSUED_AT, issuedAt.getEpochSecond());
        if (expiresAt != null) out.put(EXPIRES_AT, expiresAt.getEpochSecond());
        out.putAll(custom);
        return out;
    }

    /** Same claims with {@code iat} and {@code exp} dropped; used when re-issuing. */
    public ClaimsBundle withoutTimestamps() {
        return new ClaimsBundle(subject, null, null, custom);
    }

    void validate() {
        for (Map.Entry<String, Object> e : custom.entrySet()) {
            String name = e.getKey();
            if (name == null || name.isBlank()) {
                throw new EncodeException("Claim names must not be blank");
            }
            if (RESERVED.contains(name)) {
                throw new EncodeException("Claim '" + name + "' is reserved; set it through the typed field");
            }
            requireJsonCompatible(name, e.getValue());
        }
    }

    private static void requireJsonCompatible(String path, Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String)) {
                    throw new EncodeException("Claim '" + path + "' has a non-string map key: " + e.getKey());
                }
                requireJsonCompatible(path + "." + e.getKey(), e.getValue());
            }
            return;
        }
        if (value instanceof Collection<?> items) {
            int i = 0;
            for (Object item : items) {
                requireJsonCompatible(path + "[" + i++ + "]", item);
            }
            return;
        }
        throw new EncodeException("Claim '" + path + "' is not JSON-serializable: " + value.getClass().getName());
    }

    private static Instant toInstant(String name, Object value) {
        if (value == null) return null;
        if (value instanceof Instant instant) return instant;
        if (value instanceof Date date) return date.toInstant();
        if (value instanceof Number number) return Instant.ofEpochSecond(number.longValue());
        throw new EncodeException("Claim '" + name + "' must be a timestamp, got " + value.getClass().getName());
    }

    // a Date handed in by the caller (e.g. nbf) is kept the way it will be serialized
    private static Object normalize(Object value) {
        return value instanceof Date date ? date.toInstant().getEpochSecond() : value;
    }
}
