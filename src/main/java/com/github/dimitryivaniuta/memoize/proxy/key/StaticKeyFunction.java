package com.github.dimitryivaniuta.memoize.proxy.key;

import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;

/**
 * Argument-independent key: identity prefix plus an optional bucket name passed as the
 * {@value #BUCKET_KEYWORD} keyword. Positional arguments are ignored.
 */
public class StaticKeyFunction implements KeyFunction {

    public static final String BUCKET_KEYWORD = "cachekey";

    @Override
    public Object key(CallableDescriptor callable, CallArguments call, Object marker) {
        Object bucket = call.keyword(BUCKET_KEYWORD, "");
        return callable.identity() + (bucket == null ? "" : bucket);
    }
}
