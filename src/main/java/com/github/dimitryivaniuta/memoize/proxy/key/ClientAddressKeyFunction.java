package com.github.dimitryivaniuta.memoize.proxy.key;

import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * Key made of the caller's user id and remote address only; every other argument is ignored.
 *
 * <p>The request is expected as the first argument. If it is not there, the call is bound and
 * the parameter named {@value #REQUEST_PARAMETER} is used instead.
 */
@RequiredArgsConstructor
public class ClientAddressKeyFunction implements KeyFunction {

    public static final String REQUEST_PARAMETER = "request";

    private final ArgumentEncoder encoder;

    @Override
    public Object key(CallableDescriptor callable, CallArguments call, Object marker) {
        Object first = call.positional().isEmpty() ? null : call.positional().get(0);
        ClientContext client = adapt(first);
        if (client == null) {
            Object[] bound = callable.bind(call);
            int idx = callable.parameters().indexOf(REQUEST_PARAMETER);
            client = adapt(idx >= 0 ? bound[idx] : first);
        }
        if (client == null) {
            throw new IllegalArgumentException(callable.identity() + " was called without a request");
        }
        Object[] parts = {client.userId(), client.remoteAddress()};
        return callable.identity() + encoder.encode(callable.identity(), parts);
    }

    static ClientContext adapt(Object candidate) {
        if (candidate instanceof ClientContext c) return c;
        if (candidate instanceof HttpServletRequest r) return new ServletClientContext(r);
        return null;
    }
}
