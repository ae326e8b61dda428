package com.github.dimitryivaniuta.memoize.proxy.interceptor;

import com.github.dimitryivaniuta.memoize.proxy.MemoizationRegistry;
import com.github.dimitryivaniuta.memoize.proxy.MemoizeSupport;
import com.github.dimitryivaniuta.memoize.proxy.annotations.Memoize;
import com.github.dimitryivaniuta.memoize.proxy.memo.MemoizedFunction;
import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import lombok.RequiredArgsConstructor;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.springframework.aop.support.AopUtils;

import java.lang.reflect.Method;

@RequiredArgsConstructor
public class MemoizeMethodInterceptor implements MethodInterceptor {

    private final MemoizationRegistry registry;

    @Override
    public Object invoke(MethodInvocation inv) throws Throwable {
        Class<?> targetClass = AopUtils.getTargetClass(inv.getThis());
        Method method = AopUtils.getMostSpecificMethod(inv.getMethod(), targetClass);

        Memoize ann = MemoizeSupport.find(targetClass, method, Memoize.class);
        if (ann == null || !ann.enabled()) return inv.proceed();
        if (method.getReturnType() == void.class) return inv.proceed();

        MemoizedFunction fn = registry.function(targetClass, method);
        return fn.execute(CallArguments.of(inv.getArguments()), inv::proceed);
    }
}
