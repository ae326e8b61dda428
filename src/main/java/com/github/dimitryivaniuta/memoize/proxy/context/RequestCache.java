package com.github.dimitryivaniuta.memoize.proxy.context;

import lombok.RequiredArgsConstructor;

/**
 * Direct get/put access to a request's memo store, for values that do not come from a
 * memoized method. Keys live in their own namespace so they never clash with memoized calls.
 */
@RequiredArgsConstructor
public class RequestCache {

    public static final String NAMESPACE = "memoize:request_cache:";

    private final ContextStores stores;

    public Object get(Object request, String key) {
        ContextScopedStore store = stores.storeFor(request);
        return store == null ? null : store.get(NAMESPACE + key, null);
    }

    /**
     * Stores {@code value} for the lifetime of the request. A {@code null} value is not stored.
     *
     * @return the value
     */
    public <T> T put(Object request, String key, T value) {
        ContextScopedStore store = stores.storeFor(request);
        if (store != null && value != null) {
            store.put(NAMESPACE + key, value);
        }
        return value;
    }
}
