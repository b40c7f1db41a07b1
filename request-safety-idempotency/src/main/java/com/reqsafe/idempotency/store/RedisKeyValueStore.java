package com.reqsafe.idempotency.store;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link KeyValueStore} on Redis. Create is {@code SET NX PX}; compare-and-set runs as one Lua script,
 * so both are atomic across every client of the same Redis.
 */
public class RedisKeyValueStore implements KeyValueStore {

    static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(
        "if redis.call('GET', KEYS[1]) == ARGV[1] then "
            + "redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) "
            + "return 1 "
            + "end "
            + "return 0",
        Long.class);

    private final StringRedisTemplate redis;

    public RedisKeyValueStore(StringRedisTemplate redis) {
        this.redis = Objects.requireNonNull(redis, "redis");
    }

    @Override
    public boolean createIfAbsent(String key, String value, Duration ttl) {
        try {
            return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl));
        } catch (DataAccessException e) {
            throw unavailable("SET NX", key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw unavailable("GET", key, e);
        }
    }

    @Override
    public boolean compareAndSet(String key, String expected, String newValue, Duration ttl) {
        try {
            Long swapped = redis.execute(COMPARE_AND_SET, List.of(key), expected, newValue, String.valueOf(ttl.toMillis()));
            return swapped != null && swapped == 1L;
        } catch (DataAccessException e) {
            throw unavailable("compare-and-set", key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redis.delete(key);
        } catch (DataAccessException e) {
            throw unavailable("DEL", key, e);
        }
    }

    private static StoreUnavailableException unavailable(String op, String key, DataAccessException e) {
        return new StoreUnavailableException("Redis " + op + " failed for " + key + ": " + e.getMessage(), e);
    }
}
