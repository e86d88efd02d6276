package com.github.dimitryivaniuta.responsecache.store;

import java.util.Map;
import java.util.OptionalLong;

/**
 * Field-level key-value store protocol used by the response cache (Redis hash semantics).
 *
 * <p>{@link #writeFields} and {@link #setExpiry} are separate calls: an entry written by one and not yet
 * touched by the other has no expiry. Callers accept that window.
 */
public interface HashStoreClient {

    /** Upserts all given fields under {@code key} (HSET). */
    void writeFields(String key, Map<String, String> fields);

    /** Sets or refreshes the time-to-live of {@code key} (EXPIRE). */
    void setExpiry(String key, long seconds);

    /** All fields under {@code key}; empty when the key does not exist or has expired (HGETALL). */
    Map<String, String> readAllFields(String key);

    /** Remaining lifetime in seconds; empty when the key is absent or never expires (TTL). */
    OptionalLong readRemainingTtl(String key);
}
