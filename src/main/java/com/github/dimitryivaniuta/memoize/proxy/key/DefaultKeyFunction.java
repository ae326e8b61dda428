package com.github.dimitryivaniuta.memoize.proxy.key;

import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Argument-sensitive key: identity prefix followed by the encoded bound arguments.
 * The context argument, when the callable has one, is left out, so the key is the same for
 * every context object.
 */
@RequiredArgsConstructor
public class DefaultKeyFunction implements KeyFunction {

    private final ArgumentEncoder encoder;

    @Override
    public Object key(CallableDescriptor callable, CallArguments call, Object marker) {
        Object[] args = callable.bind(call);
        if (callable.hasContextArgument()) {
            args = without(args, callable.contextIndex());
        }
        return callable.identity() + encoder.encode(callable.identity(), args);
    }

    private static Object[] without(Object[] args, int index) {
        Object[] out = Arrays.copyOf(args, args.length - 1);
        System.arraycopy(args, index + 1, out, index, args.length - index - 1);
        return out;
    }
}
