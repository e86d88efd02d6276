package com.github.dimitryivaniuta.responsecache.web;

import java.io.IOException;
import java.util.Map;

/**
 * Response-writing operations available to handlers.
 *
 * <p>Handlers receive an instance by declaring a {@code ResponseWriter} parameter. When the response cache
 * is active for the request the instance records what is written so it can be replayed later; handlers
 * do not need to know which one they got.
 *
 * <p>{@link #send(String)} and {@link #json(Object)} complete the response. Everything else only
 * prepares it.
 */
public interface ResponseWriter {

    /** Request attribute holding the writer that applies to the current request. */
    String ATTRIBUTE = ResponseWriter.class.getName();

    ResponseWriter status(int code);

    ResponseWriter header(String name, String value);

    ResponseWriter headers(Map<String, String> headers);

    /**
     * Marks the response as a download. The filename (may be null) goes into {@code Content-Disposition}
     * and its extension determines the content type.
     */
    ResponseWriter attachment(String filename);

    void send(String body) throws IOException;

    void json(Object body) throws IOException;

    /**
     * Overrides the cache lifetime of this response. Ignored unless the response is being cached,
     * and ignored for non-positive values.
     */
    default ResponseWriter ttl(long seconds) {
        return this;
    }

    /** Same as {@link #ttl(long)}; input that is not a whole number keeps the current TTL. */
    default ResponseWriter ttl(String seconds) {
        if (seconds == null) return this;
        long parsed;
        try {
            parsed = Long.parseLong(seconds.trim());
        } catch (NumberFormatException e) {
            return this;
        }
        return ttl(parsed);
    }
}
