package com.github.dimitryivaniuta.memoize.proxy.context;

import org.springframework.cache.support.NullValue;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key-value map owned by one context object. Entries never expire; they live as long as
 * the context does. Shared by every memoized callable that uses the same context, so keys
 * are namespaced by callable identity.
 */
public final class ContextScopedStore {

    private final Map<String, Object> entries = new ConcurrentHashMap<>();

    /**
     * @return stored value (may be {@code null}) or {@code absent} when there is no entry
     */
    public Object get(String key, Object absent) {
        Object v = entries.get(key);
        if (v == null) return absent;
        return v == NullValue.INSTANCE ? null : v;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public void put(String key, Object value) {
        entries.put(key, value == null ? NullValue.INSTANCE : value);
    }

    public void remove(String key) {
        entries.remove(key);
    }

    /**
     * @return number of removed entries
     */
    public int removeByPrefix(String prefix) {
        int before = entries.size();
        entries.keySet().removeIf(k -> k.startsWith(prefix));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }
}
