package com.github.dimitryivaniuta.memoize.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.memoize.config.MemoizeConfig;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoDefault;
import com.github.dimitryivaniuta.memoize.proxy.annotations.Memoize;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInContext;
import com.github.dimitryivaniuta.memoize.proxy.key.StaticKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.support.ArgumentBindingException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.Advised;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Scope;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoizeBeanPostProcessorTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfig.class);

    @Configuration(proxyBeanMethods = false)
    @Import({MemoizeConfig.class, MemoizeBeanPostProcessor.class})
    static class TestConfig {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        PricingService pricingService() {
            return new PricingService();
        }

        @Bean
        @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
        QuoteDraft quoteDraft() {
            return new QuoteDraft();
        }
    }

    static class QuoteDraft {
        private static final AtomicInteger SEQ = new AtomicInteger();
        private final int id = SEQ.incrementAndGet();

        @Memoize
        public String shared(String sku) {
            return sku + "@" + id;
        }

        @MemoizeInContext
        public String own(String sku) {
            return sku + "@" + id;
        }
    }

    static class Cart {
    }

    // state is read through methods: fields of a class-based proxy are not initialized
    static class PricingService {
        private final AtomicInteger calls = new AtomicInteger();

        public int calls() {
            return calls.get();
        }

        @Memoize
        public String quote(String sku, @MemoDefault("1") int qty) {
            return sku + "x" + qty + "#" + calls.incrementAndGet();
        }

        @Memoize(keyFunction = StaticKeyFunction.class)
        public String catalog(String region) {
            return region + "#" + calls.incrementAndGet();
        }

        @MemoizeInContext
        public String surcharge(String sku) {
            return sku + "#" + calls.incrementAndGet();
        }

        @MemoizeInContext(context = "cart")
        public String total(Cart cart, int discount) {
            return discount + "#" + calls.incrementAndGet();
        }

        @Memoize
        public void touch() {
            calls.incrementAndGet();
        }

        @Memoize(enabled = false)
        public String live(String sku) {
            return sku + "#" + calls.incrementAndGet();
        }

        @Memoize
        public String failing(String sku) {
            calls.incrementAndGet();
            throw new IllegalArgumentException("unknown sku " + sku);
        }
    }

    @Test
    void proxiesAnnotatedBeansAndCachesResults() {
        runner.run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);

            assertThat(AopUtils.isAopProxy(service)).isTrue();
            String first = service.quote("A", 2);
            assertThat(service.quote("A", 2)).isEqualTo(first);
            assertThat(service.quote("B", 2)).isNotEqualTo(first);
            assertThat(service.calls()).isEqualTo(2);
        });
    }

    @Test
    void registryHandleDeletesEntryOfProxiedMethod() {
        runner.run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);
            MemoizationRegistry registry = ctx.getBean(MemoizationRegistry.class);
            String first = service.quote("A", 1);

            // qty falls back to its declared default
            registry.function(PricingService.class, "quote").delete("A");

            assertThat(service.quote("A", 1)).isNotEqualTo(first);
        });
    }

    @Test
    void defaultTtlComesFromProperties() {
        runner.withPropertyValues("memoize.default-ttl-seconds=42").run(ctx -> {
            MemoizationRegistry registry = ctx.getBean(MemoizationRegistry.class);

            assertThat(registry.function(PricingService.class, "quote").getTtlSeconds()).isEqualTo(42);
        });
    }

    @Test
    void staticKeyFunctionSharesOneEntry() {
        runner.run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);

            String first = service.catalog("eu");

            assertThat(service.catalog("us")).isEqualTo(first);
            assertThat(service.calls()).isEqualTo(1);
        });
    }

    @Test
    void receiverScopedCacheCanBeCleared() {
        runner.run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);
            MemoizationRegistry registry = ctx.getBean(MemoizationRegistry.class);
            Object target = ((Advised) service).getTargetSource().getTarget();

            String first = service.surcharge("A");
            assertThat(service.surcharge("A")).isEqualTo(first);

            assertThat(registry.contextFunction(PricingService.class, "surcharge").clear(target)).isEqualTo(1);
            assertThat(service.surcharge("A")).isNotEqualTo(first);
        });
    }

    @Test
    void namedContextParameterSelectsTheStore() {
        runner.run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);
            MemoizationRegistry registry = ctx.getBean(MemoizationRegistry.class);
            Cart one = new Cart();
            Cart two = new Cart();

            String first = service.total(one, 5);
            assertThat(service.total(one, 5)).isEqualTo(first);
            assertThat(service.total(two, 5)).isNotEqualTo(first);
            assertThat(service.total(null, 5)).isNotEqualTo(service.total(null, 5));

            var total = registry.contextFunction(PricingService.class, "total");
            assertThat(total.cache(one).size()).isEqualTo(1);
            total.delete(one, 5);
            assertThat(total.cache(one).size()).isZero();
            assertThat(total.cache(two).size()).isEqualTo(1);
        });
    }

    @Test
    void prototypeInstancesShareGlobalEntriesButNotContextEntries() {
        runner.run(ctx -> {
            QuoteDraft first = ctx.getBean(QuoteDraft.class);
            QuoteDraft second = ctx.getBean(QuoteDraft.class);

            // the receiver is not part of a @Memoize key
            assertThat(second.shared("A")).isEqualTo(first.shared("A"));
            // @MemoizeInContext stores per instance
            assertThat(second.own("A")).isNotEqualTo(first.own("A"));
        });
    }

    @Test
    void voidDisabledAndFailingMethodsAreNotCached() {
        runner.run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);

            service.touch();
            service.touch();
            assertThat(service.calls()).isEqualTo(2);

            assertThat(service.live("A")).isNotEqualTo(service.live("A"));
            assertThat(service.calls()).isEqualTo(4);

            assertThatThrownBy(() -> service.failing("Z")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.failing("Z")).isInstanceOf(IllegalArgumentException.class);
            assertThat(service.calls()).isEqualTo(6);
        });
    }

    @Test
    void hitsAndMissesAreExposedAsMetrics() {
        runner.run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);
            MeterRegistry meters = ctx.getBean(MeterRegistry.class);

            service.quote("A", 1);
            service.quote("A", 1);

            assertThat(meters.get("memoize_misses_total").tag("method", "PricingService#quote")
                    .counter().count()).isEqualTo(1.0);
            assertThat(meters.get("memoize_hits_total").tag("store", "backend").counter().count()).isEqualTo(1.0);
        });
    }

    @Test
    void unknownHandleNameIsRejected() {
        runner.run(ctx -> {
            MemoizationRegistry registry = ctx.getBean(MemoizationRegistry.class);

            assertThatThrownBy(() -> registry.function(PricingService.class, "calls"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.function(PricingService.class, "quote").delete("A", 1, 2))
                    .isInstanceOf(ArgumentBindingException.class);
        });
    }

    @Test
    void disabledToolkitLeavesBeansUntouched() {
        runner.withPropertyValues("memoize.enabled=false").run(ctx -> {
            PricingService service = ctx.getBean(PricingService.class);

            assertThat(AopUtils.isAopProxy(service)).isFalse();
            assertThat(service.quote("A", 1)).isNotEqualTo(service.quote("A", 1));
        });
    }
}
