package com.github.dimitryivaniuta.responsecache.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.responsecache.cache.CachedResponse;
import com.github.dimitryivaniuta.responsecache.cache.ResponseCaptureState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.util.Map;

/**
 * Decorator that records a replayable {@link CachedResponse} while forwarding every call unchanged.
 *
 * <p>{@code status}, {@code header(s)} and {@code attachment} only update the capture state.
 * {@code send} and {@code json} hand the finished entry to the {@link EntrySink} and then forward.
 * Anything that goes wrong while capturing is logged; the forwarded call is always made.
 *
 * <p>One instance per request.
 */
@Slf4j
public final class CapturingResponseWriter implements ResponseWriter {

    /** Receives the captured entry together with the TTL in effect when the body was emitted. */
    @FunctionalInterface
    public interface EntrySink {
        void store(CachedResponse entry, long ttlSeconds);
    }

    private final ResponseWriter delegate;
    private final ResponseCaptureState state;
    private final ObjectMapper mapper;
    private final EntrySink sink;

    public CapturingResponseWriter(ResponseWriter delegate,
                                   ResponseCaptureState state,
                                   ObjectMapper mapper,
                                   EntrySink sink) {
        this.delegate = delegate;
        this.state = state;
        this.mapper = mapper;
        this.sink = sink;
    }

    @Override
    public ResponseWriter status(int code) {
        state.recordStatus(code);
        delegate.status(code);
        return this;
    }

    @Override
    public ResponseWriter header(String name, String value) {
        state.recordHeader(name, value);
        delegate.header(name, value);
        return this;
    }

    @Override
    public ResponseWriter headers(Map<String, String> headers) {
        state.recordHeaders(headers);
        delegate.headers(headers);
        return this;
    }

    @Override
    public ResponseWriter attachment(String filename) {
        state.recordAttachment(filename);
        delegate.attachment(filename);
        return this;
    }

    @Override
    public ResponseWriter ttl(long seconds) {
        if (!state.overrideTtl(seconds)) {
            log.debug("Ignoring ttl override {}, keeping {}s", seconds, state.ttlSeconds());
        }
        return this;
    }

    @Override
    public void send(String body) throws IOException {
        capture(body);
        delegate.send(body);
    }

    @Override
    public void json(Object body) throws IOException {
        state.recordHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        try {
            capture(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.warn("Response body not serializable, not caching it: {}", e.getOriginalMessage());
        }
        delegate.json(body);
    }

    private void capture(String body) {
        try {
            sink.store(state.toEntry(body), state.ttlSeconds());
        } catch (RuntimeException e) {
            log.warn("Capturing response for cache failed, reason={}", e.toString());
        }
    }
}
