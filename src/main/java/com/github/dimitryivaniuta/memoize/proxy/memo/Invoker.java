package com.github.dimitryivaniuta.memoize.proxy.memo;

/**
 * Body of a named function: receives the bound argument vector, one value per declared parameter.
 */
@FunctionalInterface
public interface Invoker {

    Object invoke(Object[] arguments) throws Exception;
}
