package com.github.dimitryivaniuta.memoize.proxy.support;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One concrete call: positional arguments plus named (keyword) arguments.
 *
 * <p>Proxied Java methods always produce all-positional calls; keyword arguments show up when
 * callers delete entries or invoke named functions by parameter name.
 * {@code null} is a legal argument value, so plain lists/maps are used instead of {@code List.of}.
 */
public record CallArguments(List<Object> positional, Map<String, Object> keywords) {

    private static final CallArguments EMPTY = new CallArguments(List.of(), Map.of());

    public CallArguments {
        positional = Collections.unmodifiableList(new ArrayList<>(positional));
        keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static CallArguments empty() {
        return EMPTY;
    }

    public static CallArguments of(Object... positional) {
        if (positional == null) {
            // a single null argument passed through varargs
            return new CallArguments(Collections.singletonList(null), Map.of());
        }
        return new CallArguments(Arrays.asList(positional), Map.of());
    }

    public static CallArguments named(String name, Object value) {
        return empty().with(name, value);
    }

    public CallArguments with(String name, Object value) {
        Map<String, Object> kw = new LinkedHashMap<>(keywords);
        kw.put(name, value);
        return new CallArguments(positional, kw);
    }

    /**
     * Inserts a value positionally when the positional prefix reaches {@code index},
     * otherwise passes it by {@code name}.
     */
    public CallArguments insert(int index, String name, Object value) {
        if (index >= 0 && index <= positional.size() && !keywords.containsKey(name)) {
            List<Object> pos = new ArrayList<>(positional);
            pos.add(index, value);
            return new CallArguments(pos, keywords);
        }
        return with(name, value);
    }

    public Object keyword(String name, Object defaultValue) {
        return keywords.containsKey(name) ? keywords.get(name) : defaultValue;
    }
}
