package com.github.dimitryivaniuta.responsecache.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.responsecache.cache.CachedResponse;
import com.github.dimitryivaniuta.responsecache.metrics.ResponseCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Typed access to cache entries on top of a {@link HashStoreClient}.
 *
 * <p>This is the only place that knows the stored field layout:
 * <pre>
 *   status      decimal status code
 *   body        response body text
 *   headers     JSON object of header name to value
 *   attachment  filename, present only when one was declared
 * </pre>
 * Every store failure is logged and absorbed here: reads degrade to a miss, writes are dropped.
 *
 * <p>The write-back executor belongs to the adapter: {@link #close()} shuts down a Spring-managed pool
 * after pending writes drain.
 */
@Slf4j
public class CacheStoreAdapter implements AutoCloseable {

    public static final String FIELD_STATUS = "status";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_HEADERS = "headers";
    public static final String FIELD_ATTACHMENT = "attachment";

    private static final TypeReference<LinkedHashMap<String, Object>> HEADERS_TYPE = new TypeReference<>() {};

    private final HashStoreClient client;
    private final ObjectMapper mapper;
    private final Executor writeExecutor;
    private final ResponseCacheMetrics metrics;

    public CacheStoreAdapter(HashStoreClient client,
                             ObjectMapper mapper,
                             Executor writeExecutor,
                             ResponseCacheMetrics metrics) {
        this.client = client;
        this.mapper = mapper;
        this.writeExecutor = writeExecutor;
        this.metrics = metrics;
    }

    public Optional<CachedResponse> read(String key) {
        Map<String, String> fields;
        try {
            fields = client.readAllFields(key);
        } catch (RuntimeException e) {
            log.warn("Response cache read failed for key={}, treating as miss, reason={}", key, e.toString());
            metrics.storeFailure(ResponseCacheMetrics.OPERATION_READ);
            return Optional.empty();
        }
        return decode(key, fields);
    }

    /** Positive remaining lifetime of {@code key}; empty when unknown. Never throws. */
    public OptionalLong remainingTtl(String key) {
        try {
            OptionalLong ttl = client.readRemainingTtl(key);
            return (ttl.isPresent() && ttl.getAsLong() > 0) ? ttl : OptionalLong.empty();
        } catch (RuntimeException e) {
            log.debug("Response cache ttl lookup failed for key={}, reason={}", key, e.toString());
            return OptionalLong.empty();
        }
    }

    /**
     * Schedules {@code writeFields} followed by {@code setExpiry} on the write-back executor.
     * Returns immediately; failures only show up in logs and metrics.
     */
    public void write(String key, CachedResponse entry, long ttlSeconds) {
        Map<String, String> fields = encode(entry);
        try {
            writeExecutor.execute(() -> writeNow(key, fields, ttlSeconds));
        } catch (RejectedExecutionException e) {
            log.warn("Response cache write rejected for key={}, reason={}", key, e.toString());
            metrics.storeFailure(ResponseCacheMetrics.OPERATION_WRITE);
        }
    }

    private void writeNow(String key, Map<String, String> fields, long ttlSeconds) {
        try {
            client.writeFields(key, fields);
            client.setExpiry(key, ttlSeconds);
            log.debug("Stored response cache entry key={}, ttl={}s, status={}", key, ttlSeconds, fields.get(FIELD_STATUS));
        } catch (RuntimeException e) {
            log.warn("Response cache write failed for key={}, reason={}", key, e.toString());
            metrics.storeFailure(ResponseCacheMetrics.OPERATION_WRITE);
        }
    }

    @Override
    public void close() {
        if (writeExecutor instanceof ExecutorConfigurationSupport pool) {
            log.info("Shutting down response cache write-back executor");
            pool.shutdown();
        }
    }

    Map<String, String> encode(CachedResponse entry) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_STATUS, Integer.toString(entry.status()));
        fields.put(FIELD_BODY, entry.body());
        fields.put(FIELD_HEADERS, headersJson(entry.headers()));
        if (entry.hasAttachment()) {
            fields.put(FIELD_ATTACHMENT, entry.attachment());
        }
        return fields;
    }

    Optional<CachedResponse> decode(String key, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) return Optional.empty();

        String status = fields.get(FIELD_STATUS);
        String body = fields.get(FIELD_BODY);
        if (status == null || body == null) {
            log.debug("Partial response cache entry key={}, fields={}", key, fields.keySet());
            return Optional.empty();
        }

        int code;
        try {
            code = Integer.parseInt(status.trim());
        } catch (NumberFormatException e) {
            log.debug("Unreadable status '{}' in response cache entry key={}", status, key);
            return Optional.empty();
        }

        return Optional.of(new CachedResponse(code, body, parseHeaders(key, fields.get(FIELD_HEADERS)), fields.get(FIELD_ATTACHMENT)));
    }

    private String headersJson(Map<String, String> headers) {
        try {
            return mapper.writeValueAsString(headers);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize response headers, storing none: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private Map<String, String> parseHeaders(String key, String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            Map<String, Object> raw = mapper.readValue(json, HEADERS_TYPE);
            if (raw == null) return Map.of();

            Map<String, String> headers = new LinkedHashMap<>();
            raw.forEach((name, value) -> {
                if (value instanceof Collection<?> values) {
                    headers.put(name, values.stream().map(String::valueOf).collect(Collectors.joining(", ")));
                } else if (value != null) {
                    headers.put(name, String.valueOf(value));
                }
            });
            return headers;
        } catch (JsonProcessingException e) {
            log.debug("Malformed headers in response cache entry key={}, serving without them", key);
            return Map.of();
        }
    }
}
