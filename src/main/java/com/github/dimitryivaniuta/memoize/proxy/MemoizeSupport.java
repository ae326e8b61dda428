package com.github.dimitryivaniuta.memoize.proxy;

import com.github.dimitryivaniuta.memoize.proxy.annotations.Memoize;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInContext;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInRequest;
import org.springframework.core.annotation.AnnotatedElementUtils;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;

public final class MemoizeSupport {
    private MemoizeSupport() {
    }

    public static boolean hasAnyMemoizeAnnotation(AnnotatedElement el) {
        return AnnotatedElementUtils.hasAnnotation(el, Memoize.class)
                || AnnotatedElementUtils.hasAnnotation(el, MemoizeInContext.class)
                || AnnotatedElementUtils.hasAnnotation(el, MemoizeInRequest.class);
    }

    // method annotation wins over the class one
    public static <A extends Annotation> A find(Class<?> cls, Method m, Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(m, type);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(cls, type);
    }
}
