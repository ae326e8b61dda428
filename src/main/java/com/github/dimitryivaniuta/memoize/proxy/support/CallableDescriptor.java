package com.github.dimitryivaniuta.memoize.proxy.support;

import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Construction-time facts about a memoized callable: its identity prefix,
 * its parameter list and, for context-scoped caching, which argument is the context.
 *
 * @param contextIndex position of the context argument in the bound vector, or {@code -1}
 *                     when the context is not one of the arguments (receiver, current request, none)
 */
public record CallableDescriptor(String identity, ParameterList parameters, int contextIndex) {

    public static final int NO_CONTEXT = -1;

    public CallableDescriptor {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        if (contextIndex < NO_CONTEXT || contextIndex >= parameters.size()) {
            throw new IllegalArgumentException("context index " + contextIndex + " out of range for " + identity);
        }
    }

    public static CallableDescriptor forMethod(Class<?> targetClass, Method method) {
        return new CallableDescriptor(MethodKeySupport.identity(targetClass, method),
                SignatureIntrospector.declaredParameters(method), NO_CONTEXT);
    }

    public static CallableDescriptor forFunction(String module, String name, ParameterList parameters) {
        return new CallableDescriptor(MethodKeySupport.functionIdentity(module, name), parameters, NO_CONTEXT);
    }

    public CallableDescriptor withContextIndex(int index) {
        return new CallableDescriptor(identity, parameters, index);
    }

    public boolean hasContextArgument() {
        return contextIndex != NO_CONTEXT;
    }

    public Object[] bind(CallArguments call) {
        return SignatureIntrospector.bind(identity, parameters, call);
    }
}
