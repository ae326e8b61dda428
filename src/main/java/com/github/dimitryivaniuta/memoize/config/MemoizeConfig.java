package com.github.dimitryivaniuta.memoize.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.memoize.proxy.KeyFunctionResolver;
import com.github.dimitryivaniuta.memoize.proxy.MemoizationRegistry;
import com.github.dimitryivaniuta.memoize.proxy.MemoizeProperties;
import com.github.dimitryivaniuta.memoize.proxy.backend.CaffeineMemoBackend;
import com.github.dimitryivaniuta.memoize.proxy.backend.MemoBackend;
import com.github.dimitryivaniuta.memoize.proxy.context.ContextStores;
import com.github.dimitryivaniuta.memoize.proxy.context.RequestCache;
import com.github.dimitryivaniuta.memoize.proxy.key.ArgumentEncoder;
import com.github.dimitryivaniuta.memoize.proxy.key.ClientAddressKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.key.DefaultKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.key.KeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.key.StaticKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.metrics.MemoizeMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Memoize wiring:
 * - Caffeine backend with per-entry TTL, namespaced by "memoize.key-prefix" and "memoize.version"
 * - context stores (instance/request lifetime caches)
 * - key functions as beans, so annotations can name them by type
 *
 * This is intentionally local (no Redis). Register another MemoBackend bean to swap it.
 */
@Configuration
@EnableConfigurationProperties(MemoizeProperties.class)
public class MemoizeConfig {

    @Bean
    public MemoBackend memoBackend(MemoizeProperties props) {
        // no expireAfter* here: the backend sets a variable expiry per entry
        return new CaffeineMemoBackend(() ->
                Caffeine.newBuilder()
                        .maximumSize(props.getMaximumSize())
                        .recordStats(),
                props.getKeyPrefix(),
                props.getVersion()
        );
    }

    @Bean
    public ArgumentEncoder argumentEncoder(ObjectMapper objectMapper) {
        return ArgumentEncoder.fieldBased(objectMapper);
    }

    @Bean
    public DefaultKeyFunction defaultKeyFunction(ArgumentEncoder encoder) {
        return new DefaultKeyFunction(encoder);
    }

    @Bean
    public StaticKeyFunction staticKeyFunction() {
        return new StaticKeyFunction();
    }

    @Bean
    public ClientAddressKeyFunction clientAddressKeyFunction(ArgumentEncoder encoder) {
        return new ClientAddressKeyFunction(encoder);
    }

    @Bean
    public ContextStores contextStores() {
        return new ContextStores();
    }

    @Bean
    public RequestCache requestCache(ContextStores stores) {
        return new RequestCache(stores);
    }

    @Bean
    public MemoizeMetrics memoizeMetrics(MeterRegistry registry) {
        return new MemoizeMetrics(registry);
    }

    @Bean
    public MemoizationRegistry memoizationRegistry(MemoBackend backend,
                                                   ContextStores stores,
                                                   AutowireCapableBeanFactory beanFactory,
                                                   MemoizeMetrics metrics,
                                                   MemoizeProperties props) {
        KeyFunctionResolver keyFunctions = type -> keyFunction(beanFactory, type);
        return new MemoizationRegistry(backend, stores, keyFunctions, metrics, props);
    }

    // registered bean of the type, else a fresh autowired instance
    private static <T extends KeyFunction> T keyFunction(AutowireCapableBeanFactory beanFactory, Class<T> type) {
        return beanFactory.getBeanProvider(type).getIfAvailable(() -> beanFactory.createBean(type));
    }
}
