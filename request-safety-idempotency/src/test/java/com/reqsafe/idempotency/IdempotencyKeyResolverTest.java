package com.reqsafe.idempotency;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class IdempotencyKeyResolverTest {

    @Test
    void defaultHeader() {
        assertThat(new IdempotencyKeyResolver(null).headerName()).isEqualTo("Idempotency-Key");
        assertThat(new IdempotencyKeyResolver().headerName()).isEqualTo("Idempotency-Key");
    }

    @Test
    void resolve_matchesHeaderIgnoringCase() {
        IdempotencyKeyResolver resolver = new IdempotencyKeyResolver();

        assertThat(resolver.resolve(Map.of("idempotency-key", " abc "))).contains("abc");
    }

    @Test
    void resolve_blankOrMissing_isAbsent() {
        IdempotencyKeyResolver resolver = new IdempotencyKeyResolver();
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");

        assertThat(resolver.resolve(headers)).isEmpty();

        headers.put("Idempotency-Key", "   ");
        assertThat(resolver.resolve(headers)).isEmpty();
    }

    @Test
    void resolve_fromLookupFunction() {
        IdempotencyKeyResolver resolver = new IdempotencyKeyResolver("X-Idem");

        assertThat(resolver.resolve(name -> name.equals("X-Idem") ? "k-42" : null)).contains("k-42");
    }
}
