package com.github.dimitryivaniuta.memoize.proxy;

import com.github.dimitryivaniuta.memoize.proxy.interceptor.ContextMemoizeMethodInterceptor;
import com.github.dimitryivaniuta.memoize.proxy.interceptor.MemoizeMethodInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.Advised;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;

import static com.github.dimitryivaniuta.memoize.proxy.MemoizeSupport.hasAnyMemoizeAnnotation;

/**
 * Wraps beans that use memoize annotations in a runtime proxy (ProxyFactory).
 *
 * <p>This is NOT @Aspect-based AOP. It is a custom proxy wiring via BeanPostProcessor.
 *
 * <p>Advice order (outer -> inner):
 * <ol>
 *   <li>Context memoization: request/instance stores are consulted first</li>
 *   <li>TTL memoization: shared backend</li>
 * </ol>
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@EnableConfigurationProperties(MemoizeProperties.class)
public final class MemoizeBeanPostProcessor implements BeanPostProcessor {

    private final MemoizeProperties props;
    // resolved lazily so the registry's own dependencies are not created during BPP registration
    private final ObjectProvider<MemoizationRegistry> registry;

    public MemoizeBeanPostProcessor(MemoizeProperties props, ObjectProvider<MemoizationRegistry> registry) {
        this.props = props;
        this.registry = registry;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        if (!props.isEnabled()) return bean;

        Class<?> targetClass = ClassUtils.getUserClass(bean);
        if (isExcluded(targetClass)) return bean;
        if (!needsProxy(targetClass)) return bean;

        MemoizationRegistry reg = registry.getObject();
        var context = new ContextMemoizeMethodInterceptor(reg);
        var ttl = new MemoizeMethodInterceptor(reg);

        // If already proxied (e.g., @Transactional), add advice to existing proxy
        if (bean instanceof Advised advised) {
            // add at index 0 in reverse order to preserve final outer->inner chain
            advised.addAdvice(0, ttl);
            advised.addAdvice(0, context);
            log.debug("Added memoize advice to existing proxy of bean '{}'", beanName);
            return bean;
        }

        ProxyFactory pf = new ProxyFactory(bean);
        // allow class-based proxying for beans without interfaces
        pf.setProxyTargetClass(true);

        pf.addAdvice(context);
        pf.addAdvice(ttl);

        log.debug("Created memoize proxy for bean '{}' ({})", beanName, targetClass.getName());
        return pf.getProxy();
    }

    private boolean needsProxy(Class<?> targetClass) {
        if (hasAnyMemoizeAnnotation(targetClass)) return true;
        for (Method m : targetClass.getMethods()) {
            if (hasAnyMemoizeAnnotation(m)) return true;
        }
        return false;
    }

    private boolean isExcluded(Class<?> targetClass) {
        String name = targetClass.getName();

        if (name.startsWith("org.springframework.") || name.startsWith("jakarta.") || name.startsWith("java.")) {
            return true;
        }

        if (props.getExcludePackages() == null || props.getExcludePackages().isEmpty()) return false;

        for (String p : props.getExcludePackages()) {
            if (p == null || p.isBlank()) continue;
            String prefix = p.endsWith(".") ? p : p + ".";
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
