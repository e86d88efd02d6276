package com.github.dimitryivaniuta.responsecache.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.responsecache.web.CachedBodyRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Derives the cache key of a request.
 *
 * <p>Feed order is part of the key space: configured headers (in configured order), then the structured
 * body when enabled, then the original URL including the query string. The digest is SHA-1, lowercase hex.
 * A missing header contributes the literal {@code "undefined"} so keys stay compatible with entries
 * written by earlier deployments.
 *
 * <p>Structured bodies are JSON containers and form-encoded fields, both fed as compact JSON in received
 * key order. A form field sent once becomes a string, a repeated one an array of strings; bracketed
 * names such as {@code a[b]=c} stay flat keys. JSON floats are written in plain notation without trailing
 * zeros ({@code 1.0} as {@code 1}, {@code 1e2} as {@code 100}); very large or very small floats therefore
 * differ from exponent notation ({@code 1.5e-7} is fed as {@code 0.00000015}).
 */
@Slf4j
public final class RequestFingerprinter {

    static final String ABSENT_HEADER = "undefined";
    private static final String ALGORITHM = "SHA-1";

    private final ResponseCacheSettings settings;
    private final ObjectMapper mapper;

    public RequestFingerprinter(ResponseCacheSettings settings, ObjectMapper mapper) {
        this.settings = settings;
        this.mapper = mapper;
    }

    public String fingerprint(HttpServletRequest request) throws IOException {
        MessageDigest md = newDigest();

        for (String name : settings.headers()) {
            update(md, headerValue(request, name));
        }

        if (settings.includeBody()) {
            structuredBody(request).ifPresent(json -> update(md, json));
        }

        update(md, originalUrl(request));
        return toHex(md.digest());
    }

    /** Request URI (context path included) plus the raw query string, if any. */
    public static String originalUrl(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String query = request.getQueryString();
        return (query == null) ? uri : uri + "?" + query;
    }

    private static String headerValue(HttpServletRequest request, String name) {
        if (request.getHeader(name) == null) return ABSENT_HEADER;
        List<String> values = Collections.list(request.getHeaders(name));
        return String.join(", ", values);
    }

    private Optional<String> structuredBody(HttpServletRequest request) throws IOException {
        if (!(request instanceof CachedBodyRequest cached)) {
            return Optional.empty();
        }
        if (cached.isFormContent()) {
            return formBody(cached.formFields());
        }
        if (!isJson(request.getContentType())) {
            return Optional.empty();
        }
        byte[] body = cached.body();
        if (body.length == 0) return Optional.empty();

        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || !node.isContainerNode()) return Optional.empty();
            return Optional.of(mapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            log.debug("Request body is not valid JSON, fingerprinting without it: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<String> formBody(MultiValueMap<String, String> fields) throws IOException {
        if (fields.isEmpty()) return Optional.empty();
        ObjectNode node = mapper.createObjectNode();
        fields.forEach((name, values) -> {
            if (values.size() == 1) {
                node.put(name, values.get(0));
            } else {
                ArrayNode array = node.putArray(name);
                values.forEach(array::add);
            }
        });
        return Optional.of(mapper.writeValueAsString(node));
    }

    private static boolean isJson(String contentType) {
        if (contentType == null || contentType.isBlank()) return false;
        try {
            MediaType type = MediaType.parseMediaType(contentType);
            return MediaType.APPLICATION_JSON.isCompatibleWith(type)
                    || (type.getSubtype() != null && type.getSubtype().endsWith("+json"));
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to create " + ALGORITHM + " digest", e);
        }
    }

    private static void update(MessageDigest md, String s) {
        md.update(s.getBytes(StandardCharsets.UTF_8));
    }

    private static String toHex(byte[] b) {
        StringBuilder sb = new StringBuilder(b.length * 2);
        for (byte x : b) sb.append(String.format("%02x", x));
        return sb.toString();
    }
}
