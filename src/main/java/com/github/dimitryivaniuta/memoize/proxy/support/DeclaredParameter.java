package com.github.dimitryivaniuta.memoize.proxy.support;

import java.util.Objects;

/**
 * A named parameter of a memoized callable, optionally with a default value.
 */
public record DeclaredParameter(String name, Class<?> type, boolean hasDefault, Object defaultValue) {

    public DeclaredParameter {
        Objects.requireNonNull(name, "name must not be null");
        type = (type == null) ? Object.class : type;
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("defaultValue given for required parameter " + name);
        }
    }

    public static DeclaredParameter required(String name) {
        return new DeclaredParameter(name, Object.class, false, null);
    }

    public static DeclaredParameter optional(String name, Object defaultValue) {
        return new DeclaredParameter(name, Object.class, true, defaultValue);
    }
}
