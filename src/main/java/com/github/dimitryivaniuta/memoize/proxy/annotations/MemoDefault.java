package com.github.dimitryivaniuta.memoize.proxy.annotations;

import java.lang.annotation.*;

/**
 * Declares a default value for a parameter of a memoized method.
 *
 * Java callers always pass every argument, so the default only matters when the
 * call is bound by parameter name (delete handles, named calls). The literal is
 * converted to the parameter type with Spring's conversion service.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface MemoDefault {

    String value();

    /**
     * Use {@code null} as the default instead of {@link #value()}.
     */
    boolean nullValue() default false;
}
