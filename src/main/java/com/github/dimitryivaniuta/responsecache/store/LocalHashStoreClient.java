package com.github.dimitryivaniuta.responsecache.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.Ticker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link HashStoreClient} backed by Caffeine with per-entry expiry.
 *
 * <p>Mirrors Redis hash semantics: writes merge into existing fields and keep the current TTL,
 * a fresh key never expires until {@link #setExpiry} is called.
 */
public final class LocalHashStoreClient implements HashStoreClient {

    private final Cache<String, StoredHash> cache;
    private final Policy.VarExpiration<String, StoredHash> expiration;

    public LocalHashStoreClient(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public LocalHashStoreClient(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new KeepCurrentExpiry())
                .build();
        this.expiration = cache.policy().expireVariably()
                .orElseThrow(() -> new IllegalStateException("Caffeine cache built without variable expiry"));
    }

    @Override
    public void writeFields(String key, Map<String, String> fields) {
        cache.asMap().compute(key, (k, current) -> (current == null)
                ? new StoredHash(new LinkedHashMap<>(fields), false)
                : current.merge(fields));
    }

    @Override
    public void setExpiry(String key, long seconds) {
        if (cache.asMap().computeIfPresent(key, (k, current) -> current.withExpiry()) == null) {
            return;
        }
        expiration.setExpiresAfter(key, seconds, TimeUnit.SECONDS);
    }

    @Override
    public Map<String, String> readAllFields(String key) {
        StoredHash hash = cache.getIfPresent(key);
        return (hash == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hash.fields()));
    }

    @Override
    public OptionalLong readRemainingTtl(String key) {
        StoredHash hash = cache.getIfPresent(key);
        if (hash == null || !hash.expiring()) return OptionalLong.empty();
        // rounded to the nearest second, as Redis TTL reports it
        return expiration.getExpiresAfter(key, TimeUnit.MILLISECONDS)
                .stream()
                .map(millis -> (millis + 500) / 1000)
                .findFirst();
    }

    private record StoredHash(Map<String, String> fields, boolean expiring) {

        StoredHash merge(Map<String, String> more) {
            Map<String, String> merged = new LinkedHashMap<>(fields);
            merged.putAll(more);
            return new StoredHash(merged, expiring);
        }

        StoredHash withExpiry() {
            return new StoredHash(fields, true);
        }
    }

    /** New keys never expire; updates and reads keep whatever expiry the key already has. */
    private static final class KeepCurrentExpiry implements Expiry<String, StoredHash> {

        @Override
        public long expireAfterCreate(String key, StoredHash value, long currentTime) {
            return Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, StoredHash value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, StoredHash value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
