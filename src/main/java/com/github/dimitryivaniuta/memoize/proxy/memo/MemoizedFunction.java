package com.github.dimitryivaniuta.memoize.proxy.memo;

import com.github.dimitryivaniuta.memoize.proxy.DoNotCache;
import com.github.dimitryivaniuta.memoize.proxy.backend.MemoBackend;
import com.github.dimitryivaniuta.memoize.proxy.backend.PrefixDeletingBackend;
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
 * Memoizes a callable into a TTL backend.
 *
 * <p>Call flow: derive the key; if it is the marker, compute without touching the backend.
 * Otherwise look the key up (the marker doubles as "not found"), and on a miss compute and
 * store the result unless the result is the marker.
 *
 * <p>No locking: two threads missing on the same key both compute, the last write wins.
 * Backend and computation failures reach the caller as they are.
 */
@Slf4j
@Getter
public final class MemoizedFunction {

    private static final String STORE_TAG = "backend";

    private final CallableDescriptor descriptor;
    private final MemoBackend backend;
    private final KeyFunction keyFunction;
    private final long ttlSeconds;
    private final Object marker;
    @Getter(AccessLevel.NONE)
    private final MemoizeMetrics metrics;
    @Getter(AccessLevel.NONE)
    private final Invoker invoker;
    @Getter(AccessLevel.NONE)
    private final String metricKey;

    @Builder
    private MemoizedFunction(CallableDescriptor descriptor,
                             MemoBackend backend,
                             KeyFunction keyFunction,
                             long ttlSeconds,
                             Object marker,
                             MemoizeMetrics metrics,
                             Invoker invoker) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction must not be null");
        this.ttlSeconds = ttlSeconds;
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

    /**
     * Calls a named function through the cache.
     */
    public Object call(CallArguments call) throws Exception {
        if (invoker == null) {
            throw new IllegalStateException(identity() + " is a proxied method; call it through its bean");
        }
        return execute(call, () -> invoker.invoke(descriptor.bind(call)));
    }

    public <X extends Throwable> Object execute(CallArguments call, Computation<X> computation) throws X {
        Object key = keyFunction.key(descriptor, call, marker);
        if (key == marker) {
            log.debug("Skipped cache check for {}", identity());
            metrics.bypass(STORE_TAG, metricKey);
            return computation.compute();
        }

        String k = String.valueOf(key);
        Object result = backend.get(k, marker);
        if (result != marker) {
            log.debug("Obtained the cached value for key={}", k);
            metrics.hit(STORE_TAG, metricKey);
            return result;
        }

        log.debug("Calculated a new value for key={}", k);
        metrics.miss(STORE_TAG, metricKey);
        result = computation.compute();
        if (result == marker) {
            metrics.storeSkipped(STORE_TAG, metricKey);
        } else {
            backend.set(k, result, ttlSeconds);
        }
        return result;
    }

    public void delete(Object... positional) {
        delete(CallArguments.of(positional));
    }

    /**
     * Drops the entry the same call would read. Nothing happens if it is not cached.
     */
    public void delete(CallArguments call) {
        Object key = keyFunction.key(descriptor, call, marker);
        if (key == marker) return;
        String k = String.valueOf(key);
        log.debug("Cleared cache value for key={}", k);
        backend.delete(k);
        metrics.evicted(STORE_TAG, metricKey, "delete");
    }

    /**
     * Drops every entry of this callable. Needs a {@link PrefixDeletingBackend}; with any other
     * backend this does nothing.
     */
    public void clear() {
        if (backend instanceof PrefixDeletingBackend p) {
            log.debug("Cleared cache values with prefix={}", identity());
            p.deleteByPrefix(identity());
            metrics.evicted(STORE_TAG, metricKey, "clear");
        } else {
            log.debug("Backend {} cannot delete by prefix; clear() of {} ignored",
                    backend.getClass().getSimpleName(), identity());
        }
    }
}
