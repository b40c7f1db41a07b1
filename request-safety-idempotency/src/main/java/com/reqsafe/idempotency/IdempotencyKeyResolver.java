package com.reqsafe.idempotency;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Pulls the idempotency key off an incoming request's headers. Blank values count as absent.
 */
public record IdempotencyKeyResolver(String headerName) {

    public static final String DEFAULT_HEADER = "Idempotency-Key";

    public IdempotencyKeyResolver(String headerName) {
        this.headerName = (headerName == null || headerName.isBlank())
            ? DEFAULT_HEADER
            : headerName;
    }

    public IdempotencyKeyResolver() {
        this(DEFAULT_HEADER);
    }

    /**
     * @param headerLookup the host's header accessor, e.g. {@code request::getHeader}
     */
    public Optional<String> resolve(Function<String, String> headerLookup) {
        String value = headerLookup.apply(headerName);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    /** Header names are matched ignoring case. */
    public Optional<String> resolve(Map<String, String> headers) {
        Map<String, String> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, value) -> {
            if (name != null) byName.put(name, value);
        });
        return resolve(byName::get);
    }
}
