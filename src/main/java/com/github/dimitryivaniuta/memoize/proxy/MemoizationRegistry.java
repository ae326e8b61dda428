package com.github.dimitryivaniuta.memoize.proxy;

import com.github.dimitryivaniuta.memoize.proxy.annotations.Memoize;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInContext;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInRequest;
import com.github.dimitryivaniuta.memoize.proxy.backend.MemoBackend;
import com.github.dimitryivaniuta.memoize.proxy.context.ContextStores;
import com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.memo.ContextLocator;
import com.github.dimitryivaniuta.memoize.proxy.memo.ContextMemoizedFunction;
import com.github.dimitryivaniuta.memoize.proxy.memo.MemoizedFunction;
import com.github.dimitryivaniuta.memoize.proxy.metrics.MemoizeMetrics;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One memoized wrapper per (bean class, method), built on first use.
 *
 * <p>The interceptors route calls through it, and application code uses it to get hold of a
 * method's wrapper for {@code delete}/{@code clear}:
 * <pre>
 *   registry.function(OrderService.class, "ordersByCustomer").delete(customerId);
 *   registry.contextFunction(PriceCalculator.class, "quote").clear(calculator);
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class MemoizationRegistry {

    private final MemoBackend backend;
    private final ContextStores stores;
    private final KeyFunctionResolver keyFunctions;
    private final MemoizeMetrics metrics;
    private final MemoizeProperties props;

    private final Map<MethodKey, MemoizedFunction> functions = new ConcurrentHashMap<>();
    private final Map<MethodKey, ContextMemoizedFunction> contextFunctions = new ConcurrentHashMap<>();

    public MemoizedFunction function(Class<?> targetClass, Method method) {
        Class<?> owner = ClassUtils.getUserClass(targetClass);
        return functions.computeIfAbsent(new MethodKey(owner, method), k -> createFunction(owner, method));
    }

    public MemoizedFunction function(Class<?> targetClass, String methodName) {
        Class<?> owner = ClassUtils.getUserClass(targetClass);
        return function(owner, uniqueMethod(owner, methodName, Memoize.class));
    }

    public ContextMemoizedFunction contextFunction(Class<?> targetClass, Method method) {
        Class<?> owner = ClassUtils.getUserClass(targetClass);
        return contextFunctions.computeIfAbsent(new MethodKey(owner, method), k -> createContextFunction(owner, method));
    }

    public ContextMemoizedFunction contextFunction(Class<?> targetClass, String methodName) {
        Class<?> owner = ClassUtils.getUserClass(targetClass);
        Method m = findMethods(owner, methodName, MemoizeInContext.class).isEmpty()
                ? uniqueMethod(owner, methodName, MemoizeInRequest.class)
                : uniqueMethod(owner, methodName, MemoizeInContext.class);
        return contextFunction(owner, m);
    }

    private MemoizedFunction createFunction(Class<?> owner, Method method) {
        Memoize ann = MemoizeSupport.find(owner, method, Memoize.class);
        if (ann == null) {
            throw new IllegalArgumentException(method + " is not annotated with @Memoize");
        }
        long ttl = ann.ttlSeconds() < 0 ? props.getDefaultTtlSeconds() : ann.ttlSeconds();
        MemoizedFunction fn = MemoizedFunction.builder()
                .descriptor(CallableDescriptor.forMethod(owner, method))
                .backend(backend)
                .keyFunction(keyFunctions.resolve(ann.keyFunction()))
                .ttlSeconds(ttl)
                .metrics(metrics)
                .build();
        log.debug("Memoizing {} in {} (ttl={}s)", fn.identity(), backend.getClass().getSimpleName(), ttl);
        return fn;
    }

    private ContextMemoizedFunction createContextFunction(Class<?> owner, Method method) {
        CallableDescriptor descriptor = CallableDescriptor.forMethod(owner, method);
        boolean instanceMethod = !Modifier.isStatic(method.getModifiers());

        MemoizeInContext inContext = MemoizeSupport.find(owner, method, MemoizeInContext.class);
        ContextLocator locator;
        Class<? extends KeyFunction> keyType;
        if (inContext != null) {
            locator = ContextLocator.resolve(inContext.context(), descriptor.parameters(), instanceMethod, false);
            keyType = inContext.keyFunction();
        } else {
            MemoizeInRequest inRequest = MemoizeSupport.find(owner, method, MemoizeInRequest.class);
            if (inRequest == null) {
                throw new IllegalArgumentException(method + " is not annotated with @MemoizeInContext or @MemoizeInRequest");
            }
            locator = ContextLocator.resolve(MemoizeInRequest.REQUEST_CONTEXT, descriptor.parameters(), instanceMethod, true);
            keyType = inRequest.keyFunction();
        }

        ContextMemoizedFunction fn = ContextMemoizedFunction.builder()
                .descriptor(descriptor)
                .locator(locator)
                .stores(stores)
                .keyFunction(keyFunctions.resolve(keyType))
                .metrics(metrics)
                .build();
        log.debug("Memoizing {} per context {}", fn.identity(), locator);
        return fn;
    }

    private static Method uniqueMethod(Class<?> owner, String name, Class<? extends Annotation> annotation) {
        List<Method> candidates = findMethods(owner, name, annotation);
        if (candidates.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one @" + annotation.getSimpleName()
                    + " method named '" + name + "' on " + owner.getName() + " but found " + candidates.size());
        }
        return candidates.get(0);
    }

    private static List<Method> findMethods(Class<?> owner, String name, Class<? extends Annotation> annotation) {
        return Arrays.stream(ReflectionUtils.getUniqueDeclaredMethods(owner, ReflectionUtils.USER_DECLARED_METHODS))
                .filter(m -> m.getName().equals(name))
                .filter(m -> MemoizeSupport.find(owner, m, annotation) != null)
                .toList();
    }

    private record MethodKey(Class<?> owner, Method method) {}
}
