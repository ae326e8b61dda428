package com.github.dimitryivaniuta.memoize.proxy.support;

import org.springframework.util.ClassUtils;
import org.springframework.util.ConcurrentReferenceHashMap;

import java.lang.reflect.Method;
import java.util.Map;

public final class MethodKeySupport {
    private MethodKeySupport() {}

    private static final Map<Method, String> IDENTITIES = new ConcurrentReferenceHashMap<>();

    /**
     * Identity prefix of a method: {@code <package>.<Type>:<name>(<ParamTypes>):}.
     * Used as key namespace, so every key of the method starts with it and nothing else does.
     * Nested types keep their {@code Outer.Inner} form. Parameter types are fully qualified, so
     * overloads differ even when their parameter types share a simple name.
     */
    public static String identity(Class<?> targetClass, Method method) {
        Class<?> owner = ClassUtils.getUserClass(targetClass);
        if (owner == method.getDeclaringClass()) {
            return IDENTITIES.computeIfAbsent(method, m -> buildIdentity(owner, m));
        }
        // inherited method seen through a subclass: keyed by the concrete class
        return buildIdentity(owner, method);
    }

    /**
     * Identity prefix of a named function that is not bound to a type:
     * {@code <module>:<name>:}.
     */
    public static String functionIdentity(String module, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("function name must not be blank");
        }
        return (module == null ? "" : module) + ":" + name + ":";
    }

    private static String buildIdentity(Class<?> owner, Method method) {
        Class<?>[] p = method.getParameterTypes();
        StringBuilder sb = new StringBuilder(owner.getPackageName())
                .append('.')
                .append(typeName(owner))
                .append(':')
                .append(method.getName())
                .append('(');
        for (int i = 0; i < p.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(p[i].getTypeName().replace('$', '.'));
        }
        return sb.append("):").toString();
    }

    private static String typeName(Class<?> owner) {
        String pkg = owner.getPackageName();
        String name = owner.getName();
        String local = pkg.isEmpty() ? name : name.substring(pkg.length() + 1);
        return local.replace('$', '.');
    }

    // Shorter key for metrics tag (avoid long signatures)
    public static String metricMethodKey(String identity) {
        int colon = identity.indexOf(':');
        String head = colon < 0 ? identity : identity.substring(0, colon);
        String tail = colon < 0 ? "" : identity.substring(colon + 1);
        int paren = tail.indexOf('(');
        String name = paren >= 0 ? tail.substring(0, paren) : tail.replace(":", "");
        int dot = head.lastIndexOf('.');
        return (dot >= 0 ? head.substring(dot + 1) : head) + "#" + name;
    }
}
