package com.github.dimitryivaniuta.responsecache.cache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A previously computed response, as stored per fingerprint.
 *
 * @param status     HTTP status (200 when the handler never set one)
 * @param body       response body text; JSON payloads are kept in their serialized form
 * @param headers    headers set through the writer, in the order they were set
 * @param attachment attachment filename, or null when none was declared
 */
public record CachedResponse(int status, String body, Map<String, String> headers, String attachment) {

    public CachedResponse {
        headers = (headers == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public boolean hasAttachment() {
        return attachment != null && !attachment.isEmpty();
    }
}
