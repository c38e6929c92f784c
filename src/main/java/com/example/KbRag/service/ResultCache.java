package com.example.KbRag.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived memo shared by all requests.
 * Safe for concurrent use; on a key collision the last write wins.
 */
public class ResultCache<K, V> {

    private final String name;
    private final Cache<K, V> cache;

    public ResultCache(String name, Duration ttl, long maxSize) {
        this(name, ttl, maxSize, Ticker.systemTicker());
    }

    public ResultCache(String name, Duration ttl, long maxSize, Ticker ticker) {
        this.name = name;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(Math.max(1L, maxSize))
                .ticker(ticker)
                .recordStats()
                .build();
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(K key, V value) {
        if (key != null && value != null) {
            cache.put(key, value);
        }
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    public void clear() {
        cache.invalidateAll();
    }

    public String name() {
        return name;
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
