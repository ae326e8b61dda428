package com.github.dimitryivaniuta.memoize.proxy;

/**
 * Do-not-cache marker.
 *
 * <p>Returned by a {@link com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction} it means
 * "bypass the cache for this call". Returned by the memoized computation it means
 * "hand this result back, but do not store it".
 *
 * <p>Wrappers always compare against the marker with {@code ==}, never {@code equals}.
 */
public final class DoNotCache {

    public static final DoNotCache MARKER = new DoNotCache();

    private DoNotCache() {
    }

    @Override
    public String toString() {
        return "DoNotCache.MARKER";
    }
}
