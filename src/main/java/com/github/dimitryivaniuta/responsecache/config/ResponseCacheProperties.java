package com.github.dimitryivaniuta.responsecache.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.Ordered;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "response-cache")
public class ResponseCacheProperties {

    public enum StoreType { REDIS, LOCAL }

    private boolean enabled = true;

    // seconds; a non-numeric value already fails binding at startup
    @Positive
    private long ttl = 60;

    private boolean includeBody = true;

    private List<String> disabled = new ArrayList<>();

    // order matters: it is part of the cache key
    private List<String> headers = new ArrayList<>();

    // null = not configured (empty list behaves the same)
    private List<String> explicit;

    @NotNull
    private StoreType store = StoreType.REDIS;

    private int filterOrder = Ordered.HIGHEST_PRECEDENCE + 20;

    @Valid
    private Local local = new Local();

    @Valid
    private WriteBack writeBack = new WriteBack();

    @Getter
    @Setter
    public static class Local {
        @Positive
        private long maximumSize = 10_000;
    }

    @Getter
    @Setter
    public static class WriteBack {
        private boolean async = true;
        @Min(1)
        private int poolSize = 2;
        @Min(0)
        private int queueCapacity = 1_000;
    }
}
