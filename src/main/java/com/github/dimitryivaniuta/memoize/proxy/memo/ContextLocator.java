package com.github.dimitryivaniuta.memoize.proxy.memo;

import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;
import com.github.dimitryivaniuta.memoize.proxy.support.DeclaredParameter;
import com.github.dimitryivaniuta.memoize.proxy.support.ParameterList;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Where a context-scoped call finds its context object.
 */
public final class ContextLocator {

    public enum Kind {
        /** one of the declared parameters */
        ARGUMENT,
        /** the target of an instance method */
        RECEIVER,
        /** servlet request bound to the current thread */
        CURRENT_REQUEST
    }

    private final Kind kind;
    private final int index;
    private final String name;

    private ContextLocator(Kind kind, int index, String name) {
        this.kind = kind;
        this.index = index;
        this.name = name;
    }

    public static ContextLocator argument(int index, String name) {
        return new ContextLocator(Kind.ARGUMENT, index, name);
    }

    public static ContextLocator receiver() {
        return new ContextLocator(Kind.RECEIVER, CallableDescriptor.NO_CONTEXT, null);
    }

    public static ContextLocator currentRequest() {
        return new ContextLocator(Kind.CURRENT_REQUEST, CallableDescriptor.NO_CONTEXT, null);
    }

    /**
     * Picks the context: the parameter called {@code contextName}; otherwise the current
     * request (request scoped), the receiver (instance methods) or the first parameter.
     */
    public static ContextLocator resolve(String contextName, ParameterList parameters,
                                         boolean instanceMethod, boolean requestScoped) {
        int idx = parameters.indexOf(contextName);
        if (idx >= 0) return argument(idx, contextName);
        if (requestScoped) return currentRequest();
        if (instanceMethod) return receiver();
        if (parameters.size() > 0) return argument(0, parameters.get(0).name());
        throw new IllegalStateException("No parameter can serve as context '" + contextName + "'");
    }

    public Kind kind() {
        return kind;
    }

    /** @return position to exclude from keys, or {@link CallableDescriptor#NO_CONTEXT} */
    public int index() {
        return index;
    }

    public Object locate(Object receiver, CallableDescriptor callable, CallArguments call) {
        return switch (kind) {
            case RECEIVER -> receiver;
            case CURRENT_REQUEST -> currentServletRequest();
            case ARGUMENT -> fromArguments(callable, call);
        };
    }

    /**
     * Puts {@code context} back into a call given without it (delete handles).
     */
    public CallArguments withContext(CallArguments call, Object context) {
        return kind == Kind.ARGUMENT ? call.insert(index, name, context) : call;
    }

    private Object fromArguments(CallableDescriptor callable, CallArguments call) {
        if (index < call.positional().size()) return call.positional().get(index);
        if (call.keywords().containsKey(name)) return call.keywords().get(name);
        DeclaredParameter p = callable.parameters().get(index);
        return p.hasDefault() ? p.defaultValue() : null;
    }

    private static Object currentServletRequest() {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes a)) return null;
        return a.getRequest();
    }

    @Override
    public String toString() {
        return kind == Kind.ARGUMENT ? kind + "(" + index + ":" + name + ")" : kind.name();
    }
}
