package com.github.dimitryivaniuta.responsecache.cache;

import com.github.dimitryivaniuta.responsecache.store.HashStoreClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable response cache configuration, validated once at construction.
 *
 * <ul>
 *   <li>{@code ttlSeconds}: default entry lifetime, must be positive</li>
 *   <li>{@code disabled}: path prefixes excluded from caching</li>
 *   <li>{@code headers}: request headers fed into the fingerprint, in this order</li>
 *   <li>{@code explicit}: when non-empty, the only cached prefixes ({@code disabled} is then ignored)</li>
 *   <li>{@code client}: backing store, required</li>
 * </ul>
 */
public final class ResponseCacheSettings {

    public static final long DEFAULT_TTL_SECONDS = 60;

    private final long ttlSeconds;
    private final boolean enabled;
    private final boolean includeBody;
    private final List<String> disabled;
    private final List<String> headers;
    private final List<String> explicit;
    private final HashStoreClient client;

    private ResponseCacheSettings(Builder b) {
        if (b.ttlSeconds <= 0) {
            throw new IllegalArgumentException("'ttl' must be a positive integer, got " + b.ttlSeconds);
        }
        if (b.client == null) {
            throw new IllegalArgumentException("'client' must be a valid hash store client");
        }
        this.ttlSeconds = b.ttlSeconds;
        this.enabled = b.enabled;
        this.includeBody = b.includeBody;
        this.disabled = copyOf(b.disabled);
        this.headers = copyOf(b.headers);
        // null entries are kept here, explicitMode() depends on seeing them
        this.explicit = (b.explicit == null) ? null : Collections.unmodifiableList(new ArrayList<>(b.explicit));
        this.client = b.client;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    public boolean enabled() {
        return enabled;
    }

    public boolean includeBody() {
        return includeBody;
    }

    public List<String> disabled() {
        return disabled;
    }

    public List<String> headers() {
        return headers;
    }

    /** May be null: no explicit allow-list configured. */
    public List<String> explicit() {
        return explicit;
    }

    public HashStoreClient client() {
        return client;
    }

    /** Explicit mode applies only to a non-empty list without null entries. */
    public boolean explicitMode() {
        return explicit != null && !explicit.isEmpty() && explicit.stream().allMatch(Objects::nonNull);
    }

    private static List<String> copyOf(List<String> in) {
        if (in == null) return List.of();
        List<String> out = new ArrayList<>(in.size());
        for (String s : in) {
            if (s != null) out.add(s);
        }
        return List.copyOf(out);
    }

    public static final class Builder {
        private long ttlSeconds = DEFAULT_TTL_SECONDS;
        private boolean enabled = true;
        private boolean includeBody = true;
        private List<String> disabled = List.of();
        private List<String> headers = List.of();
        private List<String> explicit;
        private HashStoreClient client;

        private Builder() {}

        public Builder ttlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder includeBody(boolean includeBody) {
            this.includeBody = includeBody;
            return this;
        }

        public Builder disabled(List<String> disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder headers(List<String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder explicit(List<String> explicit) {
            this.explicit = explicit;
            return this;
        }

        public Builder client(HashStoreClient client) {
            this.client = client;
            return this;
        }

        public ResponseCacheSettings build() {
            return new ResponseCacheSettings(this);
        }
    }
}
