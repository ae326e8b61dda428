package com.github.dimitryivaniuta.memoize.proxy.support;

import com.github.dimitryivaniuta.memoize.proxy.MemoizeException;
import lombok.Getter;

/**
 * A call does not match the declared parameter list of the memoized callable
 * (missing required argument, unknown keyword, too many arguments).
 */
@Getter
public class ArgumentBindingException extends MemoizeException {

    private final String callable;

    public ArgumentBindingException(String callable, String message) {
        super(callable + ": " + message);
        this.callable = callable;
    }
}
