package com.github.dimitryivaniuta.memoize.proxy;

import com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction;

/**
 * Turns the key function type named on an annotation into an instance.
 */
@FunctionalInterface
public interface KeyFunctionResolver {

    KeyFunction resolve(Class<? extends KeyFunction> type);
}
