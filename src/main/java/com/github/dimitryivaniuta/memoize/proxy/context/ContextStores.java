package com.github.dimitryivaniuta.memoize.proxy.context;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Finds the memo store of a context object.
 *
 * <p>{@link MemoContext} implementations hand out their own store. Any other object gets one
 * from an identity-keyed registry holding the context weakly, so the store is dropped together
 * with its context and {@code equals}/{@code hashCode} of the context play no role.
 */
public class ContextStores {

    private final Cache<Object, ContextScopedStore> registry = Caffeine.newBuilder()
            .weakKeys()
            .build();

    /**
     * @return the store of {@code context}, created on first use; {@code null} for a {@code null} context
     */
    public ContextScopedStore storeFor(Object context) {
        if (context == null) return null;
        if (context instanceof MemoContext mc) return mc.memoStore();
        // atomic per key: concurrent first access still yields a single store
        return registry.get(context, c -> new ContextScopedStore());
    }

    /**
     * @return the existing store or {@code null}, without creating one
     */
    public ContextScopedStore existingStoreFor(Object context) {
        if (context == null) return null;
        if (context instanceof MemoContext mc) return mc.memoStore();
        return registry.getIfPresent(context);
    }
}
