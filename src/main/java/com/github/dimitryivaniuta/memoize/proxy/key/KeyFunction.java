package com.github.dimitryivaniuta.memoize.proxy.key;

import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;

/**
 * Derives the cache key of one call.
 *
 * <p>Returns a {@link String} key, or the do-not-cache marker passed in, which tells the
 * wrapper to skip the cache for this call. Keys should start with
 * {@link CallableDescriptor#identity()} so that prefix invalidation reaches them.
 */
@FunctionalInterface
public interface KeyFunction {

    Object key(CallableDescriptor callable, CallArguments call, Object marker);
}
