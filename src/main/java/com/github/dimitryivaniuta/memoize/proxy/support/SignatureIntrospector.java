package com.github.dimitryivaniuta.memoize.proxy.support;

import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoDefault;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.MethodParameter;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.convert.ConversionService;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.core.convert.support.DefaultConversionService;
import org.springframework.util.ConcurrentReferenceHashMap;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads declared parameter lists and binds concrete calls onto them.
 */
public final class SignatureIntrospector {

    private static final ParameterNameDiscoverer NAMES = new DefaultParameterNameDiscoverer();
    private static final ConversionService CONVERSION = DefaultConversionService.getSharedInstance();

    // soft references: entries can be reclaimed together with unloaded classes
    private static final Map<Method, ParameterList> DECLARED = new ConcurrentReferenceHashMap<>();

    private SignatureIntrospector() {
    }

    public static ParameterList declaredParameters(Method method) {
        return DECLARED.computeIfAbsent(method, SignatureIntrospector::introspect);
    }

    private static ParameterList introspect(Method method) {
        String[] names = NAMES.getParameterNames(method);
        Parameter[] params = method.getParameters();
        if (names == null) {
            throw new IllegalStateException("Parameter names unavailable for " + method
                    + "; compile with -parameters");
        }

        List<DeclaredParameter> list = new ArrayList<>(params.length);
        for (int i = 0; i < params.length; i++) {
            MemoDefault def = AnnotatedElementUtils.findMergedAnnotation(params[i], MemoDefault.class);
            Class<?> type = params[i].getType();
            if (def == null) {
                list.add(new DeclaredParameter(names[i], type, false, null));
            } else {
                Object value = def.nullValue() ? null : CONVERSION.convert(def.value(),
                        TypeDescriptor.valueOf(String.class), new TypeDescriptor(new MethodParameter(method, i)));
                list.add(new DeclaredParameter(names[i], type, true, value));
            }
        }
        return new ParameterList(list);
    }

    /**
     * Binds a call onto the declared parameters.
     *
     * @param callable identity used in error messages
     * @return one value per declared parameter, in declaration order
     * @throws ArgumentBindingException if the call does not fit the declaration
     */
    public static Object[] bind(String callable, ParameterList declared, CallArguments call) {
        List<Object> positional = call.positional();
        Map<String, Object> keywords = call.keywords();
        int n = declared.size();

        // fast path: all-positional call of the exact arity
        if (keywords.isEmpty() && positional.size() == n) {
            return positional.toArray();
        }

        if (positional.size() > n) {
            throw new ArgumentBindingException(callable, "takes " + n + " arguments but "
                    + positional.size() + " were given");
        }

        Object[] bound = new Object[n];
        boolean[] filled = new boolean[n];
        for (int i = 0; i < positional.size(); i++) {
            bound[i] = positional.get(i);
            filled[i] = true;
        }

        Set<String> known = new HashSet<>(declared.names());
        for (Map.Entry<String, Object> e : keywords.entrySet()) {
            if (!known.contains(e.getKey())) {
                throw new ArgumentBindingException(callable, "got an unexpected keyword argument '" + e.getKey() + "'");
            }
            int idx = declared.indexOf(e.getKey());
            if (filled[idx]) {
                throw new ArgumentBindingException(callable, "got multiple values for argument '" + e.getKey() + "'");
            }
            bound[idx] = e.getValue();
            filled[idx] = true;
        }

        List<String> missing = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (filled[i]) continue;
            DeclaredParameter p = declared.get(i);
            if (p.hasDefault()) {
                bound[i] = p.defaultValue();
            } else {
                missing.add(p.name());
            }
        }
        if (!missing.isEmpty()) {
            throw new ArgumentBindingException(callable, "missing required arguments " + missing);
        }
        return bound;
    }
}
