package com.github.dimitryivaniuta.responsecache.sample;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counter: each computed (non-cached) response carries a new value.
 */
@Component
public class DemoCounter {

    private final AtomicLong value = new AtomicLong();

    public long next() {
        return value.getAndIncrement();
    }
}
