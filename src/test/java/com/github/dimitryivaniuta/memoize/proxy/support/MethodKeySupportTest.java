package com.github.dimitryivaniuta.memoize.proxy.support;

import org.junit.jupiter.api.Test;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MethodKeySupportTest {

    static class AClass {
        public void aMethod() {
        }

        public void aMethod(int x) {
        }

        public static void aStaticMethod() {
        }

        public void dated(java.util.Date d) {
        }

        public void dated(java.sql.Date d) {
        }

        public void named(String[] names) {
        }
    }

    static class BClass extends AClass {
    }

    private static final String PKG = "com.github.dimitryivaniuta.memoize.proxy.support";

    @Test
    void identityOfInstanceMethod() {
        Method m = ReflectionUtils.findMethod(AClass.class, "aMethod");

        assertThat(MethodKeySupport.identity(AClass.class, m))
                .isEqualTo(PKG + ".MethodKeySupportTest.AClass:aMethod():");
    }

    @Test
    void identityOfStaticMethodKeepsDeclaringType() {
        Method m = ReflectionUtils.findMethod(AClass.class, "aStaticMethod");

        assertThat(MethodKeySupport.identity(AClass.class, m))
                .isEqualTo(PKG + ".MethodKeySupportTest.AClass:aStaticMethod():");
    }

    @Test
    void overloadsShouldNotShareIdentity() {
        Method noArgs = ReflectionUtils.findMethod(AClass.class, "aMethod");
        Method oneArg = ReflectionUtils.findMethod(AClass.class, "aMethod", int.class);

        assertThat(MethodKeySupport.identity(AClass.class, oneArg))
                .endsWith(":aMethod(int):")
                .isNotEqualTo(MethodKeySupport.identity(AClass.class, noArgs));

        Method utilDate = ReflectionUtils.findMethod(AClass.class, "dated", java.util.Date.class);
        Method sqlDate = ReflectionUtils.findMethod(AClass.class, "dated", java.sql.Date.class);

        assertThat(MethodKeySupport.identity(AClass.class, utilDate))
                .endsWith(":dated(java.util.Date):")
                .isNotEqualTo(MethodKeySupport.identity(AClass.class, sqlDate));
        assertThat(MethodKeySupport.identity(AClass.class, sqlDate)).endsWith(":dated(java.sql.Date):");
    }

    @Test
    void parameterTypesAreFullyQualified() {
        Method m = ReflectionUtils.findMethod(AClass.class, "named", String[].class);

        assertThat(MethodKeySupport.identity(AClass.class, m))
                .isEqualTo(PKG + ".MethodKeySupportTest.AClass:named(java.lang.String[]):");
        assertThat(MethodKeySupport.metricMethodKey(MethodKeySupport.identity(AClass.class, m)))
                .isEqualTo("AClass#named");
    }

    @Test
    void inheritedMethodIsNamespacedByConcreteClass() {
        Method m = ReflectionUtils.findMethod(AClass.class, "aMethod");

        assertThat(MethodKeySupport.identity(BClass.class, m))
                .isEqualTo(PKG + ".MethodKeySupportTest.BClass:aMethod():");
    }

    @Test
    void identityIsComputedOnce() {
        Method m = ReflectionUtils.findMethod(AClass.class, "aMethod");

        assertThat(MethodKeySupport.identity(AClass.class, m)).isSameAs(MethodKeySupport.identity(AClass.class, m));
    }

    @Test
    void functionIdentityHasNoTypeComponent() {
        assertThat(MethodKeySupport.functionIdentity("reports", "monthly")).isEqualTo("reports:monthly:");
        assertThat(MethodKeySupport.functionIdentity(null, "monthly")).isEqualTo(":monthly:");
        assertThatThrownBy(() -> MethodKeySupport.functionIdentity("reports", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void metricMethodKeyIsShort() {
        assertThat(MethodKeySupport.metricMethodKey("com.acme.OrderService:byCustomer(Long):"))
                .isEqualTo("OrderService#byCustomer");
        assertThat(MethodKeySupport.metricMethodKey("reports:monthly:")).isEqualTo("reports#monthly");
    }
}
