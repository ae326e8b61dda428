package com.github.dimitryivaniuta.memoize.proxy.memo;

import com.github.dimitryivaniuta.memoize.proxy.DoNotCache;
import com.github.dimitryivaniuta.memoize.proxy.context.ContextScopedStore;
import com.github.dimitryivaniuta.memoize.proxy.context.ContextStores;
import com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.metrics.MemoizeMetrics;
import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;
import com.github.dimitryivaniuta.memoize.proxy.support.MethodKeySupport;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Memoizes a callable into the store of a context object (an instance, a request).
 * Results live as long as the context does; there is no TTL.
 *
 * <p>The context is never part of the key: it picks the store, the remaining arguments pick
 * the entry. A {@code null} context disables caching for that call.
 */
@Slf4j
@Getter
public final class ContextMemoizedFunction {

    private static final String STORE_TAG = "context";

    private final CallableDescriptor descriptor;
    private final ContextLocator locator;
    private final KeyFunction keyFunction;
    private final Object marker;
    @Getter(AccessLevel.NONE)
    private final ContextStores stores;
    @Getter(AccessLevel.NONE)
    private final MemoizeMetrics metrics;
    @Getter(AccessLevel.NONE)
    private final Invoker invoker;
    @Getter(AccessLevel.NONE)
    private final String metricKey;

    /**
     * @param descriptor identity and parameters; the context index is taken from {@code locator}
     */
    @Builder
    private ContextMemoizedFunction(CallableDescriptor descriptor,
                                    ContextLocator locator,
                                    ContextStores stores,
                                    KeyFunction keyFunction,
                                    Object marker,
                                    MemoizeMetrics metrics,
                                    Invoker invoker) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.descriptor = descriptor.withContextIndex(locator.index());
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction must not be null");
        this.marker = marker == null ? DoNotCache.MARKER : marker;
        this.metrics = metrics == null ? MemoizeMetrics.detached() : metrics;
        this.invoker = invoker;
        this.metricKey = MethodKeySupport.metricMethodKey(descriptor.identity());
    }

    public String identity() {
        return descriptor.identity();
    }

    public Object call(Object... positional) throws Exception {
        return call(CallArguments.of(positional));
    }

    public Object call(CallArguments call) throws Exception {
        if (invoker == null) {
            throw new IllegalStateException(identity() + " is a proxied method; call it through its bean");
        }
        return execute(null, call, () -> invoker.invoke(descriptor.bind(call)));
    }

    /**
     * @param receiver target of the call, consulted when the context is the receiver
     */
    public <X extends Throwable> Object execute(Object receiver, CallArguments call, Computation<X> computation) throws X {
        Object context = locator.locate(receiver, descriptor, call);
        ContextScopedStore store = stores.storeFor(context);
        if (store == null) {
            log.debug("No context for {}, computing without cache", identity());
            return computation.compute();
        }

        Object key = keyFunction.key(descriptor, call, marker);
        if (key == marker) {
            log.debug("Skipped cache check for {}", identity());
            metrics.bypass(STORE_TAG, metricKey);
            return computation.compute();
        }

        String k = String.valueOf(key);
        Object cached = store.get(k, marker);
        if (cached != marker) {
            log.debug("Obtained the cached value for key={}", k);
            metrics.hit(STORE_TAG, metricKey);
            return cached;
        }

        log.debug("Calculated a new value for key={}", k);
        metrics.miss(STORE_TAG, metricKey);
        Object result = computation.compute();
        if (result == marker) {
            metrics.storeSkipped(STORE_TAG, metricKey);
        } else {
            store.put(k, result);
        }
        return result;
    }

    public void delete(Object context, Object... arguments) {
        delete(context, CallArguments.of(arguments));
    }

    /**
     * Drops the entry of one call from {@code context}'s store.
     *
     * @param call the call's arguments without the context
     */
    public void delete(Object context, CallArguments call) {
        ContextScopedStore store = stores.existingStoreFor(context);
        if (store == null) return;
        Object key = keyFunction.key(descriptor, locator.withContext(call, context), marker);
        if (key == marker) return;
        String k = String.valueOf(key);
        log.debug("Cleared cache value for key={}", k);
        store.remove(k);
        metrics.evicted(STORE_TAG, metricKey, "delete");
    }

    /**
     * Drops this callable's entries from {@code context}'s store; entries of other callables stay.
     *
     * @return number of removed entries
     */
    public int clear(Object context) {
        ContextScopedStore store = stores.existingStoreFor(context);
        if (store == null) return 0;
        int removed = store.removeByPrefix(identity());
        log.debug("Cleared {} cache values with prefix={}", removed, identity());
        metrics.evicted(STORE_TAG, metricKey, "clear");
        return removed;
    }

    /**
     * @return the store of {@code context} (shared with other callables), or {@code null} for a null context
     */
    public ContextScopedStore cache(Object context) {
        return stores.storeFor(context);
    }
}
