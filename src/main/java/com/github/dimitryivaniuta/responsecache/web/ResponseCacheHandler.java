package com.github.dimitryivaniuta.responsecache.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.responsecache.cache.CachedResponse;
import com.github.dimitryivaniuta.responsecache.cache.RequestFingerprinter;
import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheSettings;
import com.github.dimitryivaniuta.responsecache.cache.ResponseCaptureState;
import com.github.dimitryivaniuta.responsecache.cache.RouteFilter;
import com.github.dimitryivaniuta.responsecache.metrics.ResponseCacheMetrics;
import com.github.dimitryivaniuta.responsecache.store.CacheStoreAdapter;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Per-request cache decision.
 *
 * <ol>
 *   <li>Bypass: caching disabled, or the route filter excludes the path. The continuation runs untouched.</li>
 *   <li>Lookup: the fingerprint is computed once and used as the store key.</li>
 *   <li>Hit: the stored response is replayed and the continuation is NOT invoked.</li>
 *   <li>Miss: the continuation runs with a {@link CapturingResponseWriter}; the entry is written when
 *       the handler emits a body through {@code send}/{@code json}. A handler that never does so leaves
 *       nothing behind.</li>
 * </ol>
 */
@Slf4j
@RequiredArgsConstructor
public class ResponseCacheHandler {

    public static final String FINGERPRINT_ATTRIBUTE = ResponseCacheHandler.class.getName() + ".fingerprint";
    public static final String MDC_KEY = "cacheKey";

    /** Continues the request pipeline with the writer the handler should use. */
    @FunctionalInterface
    public interface Continuation {
        void proceed(ResponseWriter writer) throws IOException, ServletException;
    }

    private final ResponseCacheSettings settings;
    private final RouteFilter routeFilter;
    private final RequestFingerprinter fingerprinter;
    private final CacheStoreAdapter store;
    private final ObjectMapper mapper;
    private final ResponseCacheMetrics metrics;

    public void handle(HttpServletRequest request, ResponseWriter writer, Continuation next)
            throws IOException, ServletException {

        if (!settings.enabled()) {
            metrics.bypassed("disabled");
            next.proceed(writer);
            return;
        }
        if (routeFilter.shouldBypass(pathWithinApplication(request))) {
            metrics.bypassed("route");
            next.proceed(writer);
            return;
        }

        String key = fingerprinter.fingerprint(request);
        request.setAttribute(FINGERPRINT_ATTRIBUTE, key);
        MDC.put(MDC_KEY, key);

        try {
            Optional<CachedResponse> cached = store.read(key);
            if (cached.isPresent()) {
                metrics.hit();
                log.debug("Response cache hit for {}", RequestFingerprinter.originalUrl(request));
                replay(key, cached.get(), writer);
                return;
            }

            metrics.miss();
            ResponseCaptureState state = new ResponseCaptureState(settings.ttlSeconds());
            next.proceed(new CapturingResponseWriter(writer, state, mapper,
                    (entry, ttlSeconds) -> store.write(key, entry, ttlSeconds)));
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private void replay(String key, CachedResponse entry, ResponseWriter writer) throws IOException {
        OptionalLong remaining = store.remainingTtl(key);
        if (remaining.isPresent()) {
            writer.header(HttpHeaders.CACHE_CONTROL, "max-age=" + remaining.getAsLong());
        }

        writer.headers(entry.headers());
        if (entry.hasAttachment()) {
            writer.attachment(entry.attachment());
        }
        writer.status(entry.status());
        writer.send(entry.body());
    }

    /** Request URI without context path and query string. */
    static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri == null) return "";
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
