package com.github.dimitryivaniuta.responsecache.cache;

import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Decides whether a path takes part in caching.
 *
 * <p>With a non-empty explicit list only its prefixes are cached and the disabled list is not consulted.
 * Otherwise every path is cached except those under a disabled prefix. Matching is a plain string prefix
 * test, so {@code /auth} also covers {@code /authenticate}.
 */
@RequiredArgsConstructor
public final class RouteFilter {

    private final ResponseCacheSettings settings;

    public boolean shouldBypass(String path) {
        String p = (path == null) ? "" : path;

        if (settings.explicitMode()) {
            return !startsWithAny(p, settings.explicit());
        }
        return startsWithAny(p, settings.disabled());
    }

    private static boolean startsWithAny(String path, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (prefix != null && path.startsWith(prefix)) return true;
        }
        return false;
    }
}
