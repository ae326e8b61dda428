package com.github.dimitryivaniuta.memoize.proxy.memo;

/**
 * The work a memoized call falls through to on a miss.
 *
 * @param <X> what the computation may throw; passed through to the caller unchanged
 */
@FunctionalInterface
public interface Computation<X extends Throwable> {

    Object compute() throws X;
}
