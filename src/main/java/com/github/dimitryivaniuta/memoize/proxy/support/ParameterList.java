package com.github.dimitryivaniuta.memoize.proxy.support;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, immutable list of the parameters a callable declares.
 */
public record ParameterList(List<DeclaredParameter> parameters) {

    public ParameterList {
        parameters = List.copyOf(parameters);
        List<String> seen = new ArrayList<>();
        for (DeclaredParameter p : parameters) {
            if (seen.contains(p.name())) {
                throw new IllegalArgumentException("duplicate parameter name: " + p.name());
            }
            seen.add(p.name());
        }
    }

    public static ParameterList of(DeclaredParameter... parameters) {
        return new ParameterList(List.of(parameters));
    }

    public static ParameterList ofNames(String... names) {
        List<DeclaredParameter> list = new ArrayList<>(names.length);
        for (String n : names) list.add(DeclaredParameter.required(n));
        return new ParameterList(list);
    }

    public int size() {
        return parameters.size();
    }

    public DeclaredParameter get(int index) {
        return parameters.get(index);
    }

    /** @return position of the named parameter or {@code -1} */
    public int indexOf(String name) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).name().equals(name)) return i;
        }
        return -1;
    }

    public List<String> names() {
        return parameters.stream().map(DeclaredParameter::name).toList();
    }
}
