/*
 * Copyright (c) 2025 Clash Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.clashrules.parser.cache;

import com.clashrules.api.model.ParseResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.function.Function;

/**
 * Bounded memo of rule line to {@link ParseResult}.
 *
 * <p>Subscriptions are refreshed periodically and mostly repeat the same lines, so results
 * are cached per exact input line. Results are immutable, which makes sharing them across
 * threads and callers safe.
 */
public class ParseResultCache {

    private final Cache<String, ParseResult> cache;

    public ParseResultCache(long maxSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    /**
     * Returns the cached result for the line, computing it with {@code parser} on a miss.
     */
    public ParseResult get(String line, Function<String, ParseResult> parser) {
        return cache.get(line, parser);
    }

    public ParseResult getIfPresent(String line) {
        return cache.getIfPresent(line);
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
