package com.github.dimitryivaniuta.memoize.proxy.annotations;

import com.github.dimitryivaniuta.memoize.proxy.key.DefaultKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction;

import java.lang.annotation.*;

/**
 * Memoizes a method's result in the shared TTL backend.
 *
 * - Intended for methods whose result depends only on their arguments.
 * - void methods are never cached.
 * - The bean instance is not part of the key: all instances of a class share entries
 *   (relevant for prototype-scoped beans). Use {@link MemoizeInContext} for per-instance results.
 * - Delete/clear handles: {@code MemoizationRegistry#function(Class, String)}.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Memoize {

    /**
     * TTL in seconds. Negative means "use memoize.default-ttl-seconds";
     * zero stores without expiry. The default backend caps TTLs at 24h
     * ({@code CaffeineMemoBackend.MAX_TTL_SECONDS}) and logs a warning when it clamps one.
     */
    long ttlSeconds() default -1;

    /**
     * Key derivation strategy, looked up as a bean of this type (or instantiated if none exists).
     */
    Class<? extends KeyFunction> keyFunction() default DefaultKeyFunction.class;

    /**
     * Allows disabling memoization on a method even if enabled on class.
     */
    boolean enabled() default true;
}
