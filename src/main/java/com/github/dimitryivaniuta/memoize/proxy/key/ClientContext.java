package com.github.dimitryivaniuta.memoize.proxy.key;

/**
 * Request-like object that knows who is calling and from where.
 */
public interface ClientContext {

    /** @return user identifier, {@code null} for anonymous callers */
    Object userId();

    String remoteAddress();
}
