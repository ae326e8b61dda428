package com.github.dimitryivaniuta.memoize.proxy.backend;

/**
 * Backend that can drop every key starting with a prefix.
 * Memoized functions need it for {@code clear()}; without it clearing is a no-op.
 */
public interface PrefixDeletingBackend extends MemoBackend {

    void deleteByPrefix(String prefix);
}
