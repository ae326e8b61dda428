package com.github.dimitryivaniuta.memoize.proxy.context;

/**
 * A context object that owns its memo store. The store must be created lazily and
 * exactly once, even when first touched from several threads.
 */
public interface MemoContext {

    ContextScopedStore memoStore();
}
