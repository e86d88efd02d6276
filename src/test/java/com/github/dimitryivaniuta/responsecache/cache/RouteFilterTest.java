package com.github.dimitryivaniuta.responsecache.cache;

import com.github.dimitryivaniuta.responsecache.store.HashStoreClient;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RouteFilterTest {

    private static RouteFilter filter(List<String> disabled, List<String> explicit) {
        return new RouteFilter(ResponseCacheSettings.builder()
                .disabled(disabled)
                .explicit(explicit)
                .client(mock(HashStoreClient.class))
                .build());
    }

    @Test
    void shouldCacheEverythingByDefault() {
        RouteFilter f = filter(List.of(), null);

        assertThat(f.shouldBypass("/cached")).isFalse();
        assertThat(f.shouldBypass("/")).isFalse();
    }

    @Test
    void shouldBypassDisabledPrefixes() {
        RouteFilter f = filter(List.of("/uncached", "/admin"), null);

        assertThat(f.shouldBypass("/uncached")).isTrue();
        assertThat(f.shouldBypass("/admin/users/1")).isTrue();
        assertThat(f.shouldBypass("/cached")).isFalse();
    }

    @Test
    void shouldMatchPlainStringPrefixNotPathSegments() {
        RouteFilter f = filter(List.of("/auth"), null);

        assertThat(f.shouldBypass("/authenticate")).isTrue();
    }

    @Test
    void shouldCacheOnlyExplicitPrefixesAndIgnoreDisabled() {
        RouteFilter f = filter(List.of("/cached"), List.of("/cached", "/api/v1"));

        assertThat(f.shouldBypass("/cached")).isFalse();
        assertThat(f.shouldBypass("/api/v1/herp/derp")).isFalse();
        assertThat(f.shouldBypass("/uncached")).isTrue();
    }

    @Test
    void shouldBypassOutsideExplicitListEvenWithNothingDisabled() {
        RouteFilter f = filter(List.of(), List.of("/api/v1"));

        assertThat(f.shouldBypass("/api/v2/items")).isTrue();
    }

    @Test
    void shouldFallBackToDisabledWhenExplicitIsEmpty() {
        RouteFilter f = filter(List.of("/uncached"), List.of());

        assertThat(f.shouldBypass("/cached")).isFalse();
        assertThat(f.shouldBypass("/uncached")).isTrue();
    }

    @Test
    void shouldFallBackToDisabledWhenExplicitHasNullEntry() {
        RouteFilter f = filter(List.of("/uncached"), Arrays.asList("/cached", null));

        assertThat(f.shouldBypass("/other")).isFalse();
        assertThat(f.shouldBypass("/uncached")).isTrue();
    }
}
