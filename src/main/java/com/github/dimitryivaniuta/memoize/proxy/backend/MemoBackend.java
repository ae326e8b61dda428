package com.github.dimitryivaniuta.memoize.proxy.backend;

/**
 * Key-value store with per-entry TTL that memoized functions write into.
 *
 * <p>The memoization layer adds no locking around these calls: whatever atomicity the
 * implementation gives is what callers get. Failures propagate to the memoized caller.
 */
public interface MemoBackend {

    /**
     * @return the stored value, or {@code defaultValue} if the key is absent or expired
     */
    Object get(String key, Object defaultValue);

    /**
     * @param ttlSeconds time to live; {@code <= 0} stores without expiry
     */
    void set(String key, Object value, long ttlSeconds);

    /**
     * Removes the key; absent keys are ignored.
     */
    void delete(String key);
}
