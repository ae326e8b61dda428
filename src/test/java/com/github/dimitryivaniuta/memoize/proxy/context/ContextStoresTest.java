package com.github.dimitryivaniuta.memoize.proxy.context;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ContextStoresTest {

    private final ContextStores stores = new ContextStores();

    static final class Calculator extends AbstractMemoContext {
    }

    // equal to every other instance: stores must still be per object
    static final class AlwaysEqual {
        @Override
        public boolean equals(Object o) {
            return o instanceof AlwaysEqual;
        }

        @Override
        public int hashCode() {
            return 1;
        }
    }

    @Test
    void nullContextHasNoStore() {
        assertThat(stores.storeFor(null)).isNull();
        assertThat(stores.existingStoreFor(null)).isNull();
    }

    @Test
    void storeIsCreatedOnceAndReused() {
        Object ctx = new Object();

        assertThat(stores.existingStoreFor(ctx)).isNull();
        ContextScopedStore s = stores.storeFor(ctx);
        assertThat(stores.storeFor(ctx)).isSameAs(s);
        assertThat(stores.existingStoreFor(ctx)).isSameAs(s);
    }

    @Test
    void storesArePerObjectIdentity() {
        AlwaysEqual a = new AlwaysEqual();
        AlwaysEqual b = new AlwaysEqual();

        assertThat(stores.storeFor(a)).isNotSameAs(stores.storeFor(b));
    }

    @Test
    void memoContextOwnsItsStore() {
        Calculator calc = new Calculator();

        assertThat(stores.storeFor(calc)).isSameAs(calc.memoStore());
        assertThat(new ContextStores().storeFor(calc)).isSameAs(calc.memoStore());
    }

    @Test
    void concurrentFirstAccessYieldsSingleStore() throws Exception {
        Object ctx = new Object();
        Calculator calc = new Calculator();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<List<ContextScopedStore>>> tasks = IntStream.range(0, threads)
                    .<Callable<List<ContextScopedStore>>>mapToObj(i -> () -> {
                        start.await();
                        return List.of(stores.storeFor(ctx), calc.memoStore());
                    })
                    .toList();
            List<Future<List<ContextScopedStore>>> futures = tasks.stream().map(pool::submit).toList();
            start.countDown();

            Set<ContextScopedStore> registryStores = new HashSet<>();
            Set<ContextScopedStore> ownStores = new HashSet<>();
            for (Future<List<ContextScopedStore>> f : futures) {
                List<ContextScopedStore> r = f.get();
                registryStores.add(r.get(0));
                ownStores.add(r.get(1));
            }

            assertThat(registryStores).hasSize(1);
            assertThat(ownStores).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void storeRemovesByPrefix() {
        ContextScopedStore s = stores.storeFor(new Object());
        s.put("a:f:[1]", 1);
        s.put("a:f:[2]", null);
        s.put("a:g:[1]", 3);

        assertThat(s.contains("a:f:[2]")).isTrue();
        assertThat(s.get("a:f:[2]", "absent")).isNull();
        assertThat(s.get("missing", "absent")).isEqualTo("absent");
        assertThat(s.removeByPrefix("a:f:")).isEqualTo(2);
        assertThat(s.keys()).containsExactly("a:g:[1]");
        assertThat(s.contains("a:f:[2]")).isFalse();
    }
}
