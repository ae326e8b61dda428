package com.github.dimitryivaniuta.memoize.proxy.key;

import com.github.dimitryivaniuta.memoize.proxy.MemoizeException;

/**
 * Arguments could not be turned into a cache key.
 */
public class KeyDerivationException extends MemoizeException {

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
