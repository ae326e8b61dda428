package com.github.dimitryivaniuta.memoize.proxy.annotations;

import com.github.dimitryivaniuta.memoize.proxy.key.DefaultKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction;

import java.lang.annotation.*;

/**
 * Memoizes a method's result for the lifetime of a context object instead of a TTL.
 *
 * The context is the parameter named {@link #context()}; if there is none, the bean
 * itself for instance methods, or the first parameter for static ones. The context is left out
 * of the key, and a null context means the call is not cached.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface MemoizeInContext {

    String DEFAULT_CONTEXT = "instance";

    String context() default DEFAULT_CONTEXT;

    Class<? extends KeyFunction> keyFunction() default DefaultKeyFunction.class;

    boolean enabled() default true;
}
