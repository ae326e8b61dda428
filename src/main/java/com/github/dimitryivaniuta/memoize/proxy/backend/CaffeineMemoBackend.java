package com.github.dimitryivaniuta.memoize.proxy.backend;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.support.NullValue;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Local Caffeine backend with a TTL per entry.
 *
 * Notes:
 * - Keys are namespaced as "keyPrefix:version:key"; bumping the version orphans old entries.
 * - TTL is clamped to 24h. A TTL of zero or less means "no expiry" (bounded by maximumSize only).
 * - null results are stored as NullValue since Caffeine rejects null values.
 * IMPORTANT:
 * Caffeine builders are mutable. The factory must hand out a fresh builder.
 */
@Slf4j
public final class CaffeineMemoBackend implements PrefixDeletingBackend {

    public static final long MAX_TTL_SECONDS = 24 * 60 * 60; // 24h safety cap

    private final Cache<String, Entry> cache;
    private final String keyPrefix;
    private final int version;

    public CaffeineMemoBackend(Supplier<Caffeine<Object, Object>> builderFactory, String keyPrefix, int version) {
        Objects.requireNonNull(builderFactory, "builderFactory must not be null");
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.version = version;
        this.cache = builderFactory.get()
                .expireAfter(new EntryExpiry())
                .build();
    }

    public CaffeineMemoBackend(Supplier<Caffeine<Object, Object>> builderFactory) {
        this(builderFactory, "", 1);
    }

    @Override
    public Object get(String key, Object defaultValue) {
        Entry e = cache.getIfPresent(namespaced(key));
        if (e == null) return defaultValue;
        return e.value() == NullValue.INSTANCE ? null : e.value();
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        if (ttlSeconds > MAX_TTL_SECONDS) {
            log.warn("TTL of {}s for key={} exceeds the {}s cap; clamped", ttlSeconds, key, MAX_TTL_SECONDS);
        }
        long ttlNanos = ttlSeconds <= 0
                ? Long.MAX_VALUE
                : TimeUnit.SECONDS.toNanos(Math.min(ttlSeconds, MAX_TTL_SECONDS));
        cache.put(namespaced(key), new Entry(value == null ? NullValue.INSTANCE : value, ttlNanos));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(namespaced(key));
    }

    @Override
    public void deleteByPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) return;
        String full = namespaced(prefix);
        cache.asMap().keySet().removeIf(k -> k.startsWith(full));
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /** Live keys without the namespace. */
    public Set<String> keys() {
        String ns = namespaced("");
        return cache.asMap().keySet().stream()
                .filter(k -> k.startsWith(ns))
                .map(k -> k.substring(ns.length()))
                .collect(Collectors.toUnmodifiableSet());
    }

    String namespaced(String key) {
        return keyPrefix + ":" + version + ":" + key;
    }

    private record Entry(Object value, long ttlNanos) {}

    private static final class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
