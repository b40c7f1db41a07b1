package com.reqsafe.idempotency.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process {@link KeyValueStore}. Entries expire lazily: an expired entry is treated as absent
 * and dropped the next time its key is touched. There is no sweeper thread.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Entry(String value, Instant expiresAt) {}

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean createIfAbsent(String key, String value, Duration ttl) {
        AtomicBoolean created = new AtomicBoolean(false);
        entries.compute(key, (k, existing) -> {
            if (existing != null && !isExpired(existing)) {
                return existing;
            }
            created.set(true);
            return new Entry(value, expiry(ttl));
        });
        return created.get();
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (isExpired(e)) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value());
    }

    @Override
    public boolean compareAndSet(String key, String expected, String newValue, Duration ttl) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        entries.computeIfPresent(key, (k, existing) -> {
            if (isExpired(existing)) {
                return null;
            }
            if (!existing.value().equals(expected)) {
                return existing;
            }
            swapped.set(true);
            return new Entry(newValue, expiry(ttl));
        });
        return swapped.get();
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    /** Live entries; expired ones that were never touched again still count. */
    public int size() {
        return entries.size();
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private boolean isExpired(Entry e) {
        return e.expiresAt() != null && !clock.instant().isBefore(e.expiresAt());
    }
}
