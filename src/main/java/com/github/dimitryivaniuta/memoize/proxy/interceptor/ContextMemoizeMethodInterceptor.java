package com.github.dimitryivaniuta.memoize.proxy.interceptor;

import com.github.dimitryivaniuta.memoize.proxy.MemoizationRegistry;
import com.github.dimitryivaniuta.memoize.proxy.MemoizeSupport;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInContext;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInRequest;
import com.github.dimitryivaniuta.memoize.proxy.memo.ContextMemoizedFunction;
import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import lombok.RequiredArgsConstructor;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.springframework.aop.support.AopUtils;

import java.lang.reflect.Method;

/**
 * Handles both {@link MemoizeInContext} and {@link MemoizeInRequest}.
 */
@RequiredArgsConstructor
public class ContextMemoizeMethodInterceptor implements MethodInterceptor {

    private final MemoizationRegistry registry;

    @Override
    public Object invoke(MethodInvocation inv) throws Throwable {
        Class<?> targetClass = AopUtils.getTargetClass(inv.getThis());
        Method method = AopUtils.getMostSpecificMethod(inv.getMethod(), targetClass);

        if (!enabled(targetClass, method)) return inv.proceed();
        if (method.getReturnType() == void.class) return inv.proceed();

        ContextMemoizedFunction fn = registry.contextFunction(targetClass, method);
        return fn.execute(inv.getThis(), CallArguments.of(inv.getArguments()), inv::proceed);
    }

    private static boolean enabled(Class<?> cls, Method m) {
        MemoizeInContext inContext = MemoizeSupport.find(cls, m, MemoizeInContext.class);
        if (inContext != null) return inContext.enabled();
        MemoizeInRequest inRequest = MemoizeSupport.find(cls, m, MemoizeInRequest.class);
        return inRequest != null && inRequest.enabled();
    }
}
