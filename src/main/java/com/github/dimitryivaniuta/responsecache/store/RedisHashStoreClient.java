package com.github.dimitryivaniuta.responsecache.store;

import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * {@link HashStoreClient} on a Redis hash per entry.
 * Connection lifecycle belongs to the {@link StringRedisTemplate}'s connection factory.
 */
public final class RedisHashStoreClient implements HashStoreClient {

    private final StringRedisTemplate redis;
    private final HashOperations<String, String, String> hashes;

    public RedisHashStoreClient(StringRedisTemplate redis) {
        this.redis = redis;
        this.hashes = redis.opsForHash();
    }

    @Override
    public void writeFields(String key, Map<String, String> fields) {
        hashes.putAll(key, fields);
    }

    @Override
    public void setExpiry(String key, long seconds) {
        redis.expire(key, Duration.ofSeconds(seconds));
    }

    @Override
    public Map<String, String> readAllFields(String key) {
        Map<String, String> entries = hashes.entries(key);
        return entries == null ? Map.of() : entries;
    }

    @Override
    public OptionalLong readRemainingTtl(String key) {
        // -2: no such key, -1: no expiry
        Long ttl = redis.getExpire(key, TimeUnit.SECONDS);
        return (ttl == null || ttl < 0) ? OptionalLong.empty() : OptionalLong.of(ttl);
    }
}
