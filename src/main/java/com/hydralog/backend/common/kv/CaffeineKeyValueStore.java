package com.hydralog.backend.common.kv;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.List;
import java.util.Optional;

/** In-memory store. Contents are lost on restart. */
public class CaffeineKeyValueStore implements KeyValueStore {

    private final Cache<String, String> cache;

    public CaffeineKeyValueStore(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, String value) {
        cache.put(key, value);
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public List<String> keysWithPrefix(String prefix) {
        return cache.asMap().keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .toList();
    }
}
