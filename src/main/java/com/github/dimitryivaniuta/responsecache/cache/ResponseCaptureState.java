package com.github.dimitryivaniuta.responsecache.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Working state of one in-flight response. Owned by a single request; not thread-safe and never pooled.
 */
public final class ResponseCaptureState {

    private static final int DEFAULT_STATUS = 200;

    private int statusCode;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private long ttlSeconds;
    private String attachment;

    public ResponseCaptureState(long defaultTtlSeconds) {
        this.ttlSeconds = defaultTtlSeconds;
    }

    public void recordStatus(int code) {
        this.statusCode = code;
    }

    public void recordHeader(String name, String value) {
        if (name == null || value == null) return;
        headers.put(name, value);
    }

    public void recordHeaders(Map<String, String> values) {
        if (values == null) return;
        values.forEach(this::recordHeader);
    }

    public void recordAttachment(String filename) {
        this.attachment = filename;
    }

    /**
     * Overrides the TTL used for this response only.
     *
     * @return false when the value was rejected (non-positive) and the previous TTL stays
     */
    public boolean overrideTtl(long seconds) {
        if (seconds <= 0) return false;
        this.ttlSeconds = seconds;
        return true;
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    public CachedResponse toEntry(String body) {
        return new CachedResponse(
                statusCode != 0 ? statusCode : DEFAULT_STATUS,
                body == null ? "" : body,
                headers,
                attachment
        );
    }
}
