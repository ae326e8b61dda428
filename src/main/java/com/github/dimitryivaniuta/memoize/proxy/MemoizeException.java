package com.github.dimitryivaniuta.memoize.proxy;

/**
 * Base type for errors raised by the memoization layer itself.
 * Backend and computation failures are never wrapped into this type.
 */
public abstract class MemoizeException extends RuntimeException {

    protected MemoizeException(String message) {
        super(message);
    }

    protected MemoizeException(String message, Throwable cause) {
        super(message, cause);
    }
}
