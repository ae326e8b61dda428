package com.github.dimitryivaniuta.memoize.proxy.annotations;

import com.github.dimitryivaniuta.memoize.proxy.key.DefaultKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction;

import java.lang.annotation.*;

/**
 * Memoizes a method's result for the lifetime of the current request.
 *
 * The request is the parameter named {@code request}, or the servlet request bound to the
 * calling thread. Shares its store with {@code RequestCache}.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface MemoizeInRequest {

    String REQUEST_CONTEXT = "request";

    Class<? extends KeyFunction> keyFunction() default DefaultKeyFunction.class;

    boolean enabled() default true;
}
