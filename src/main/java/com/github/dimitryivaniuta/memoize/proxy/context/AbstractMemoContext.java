package com.github.dimitryivaniuta.memoize.proxy.context;

/**
 * Base class for types that carry their own memo store.
 */
public abstract class AbstractMemoContext implements MemoContext {

    private volatile ContextScopedStore memoStore;

    @Override
    public final ContextScopedStore memoStore() {
        ContextScopedStore s = memoStore;
        if (s == null) {
            synchronized (this) {
                s = memoStore;
                if (s == null) {
                    s = new ContextScopedStore();
                    memoStore = s;
                }
            }
        }
        return s;
    }
}
