package com.github.dimitryivaniuta.memoize.proxy.context;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCacheTest {

    private final ContextStores stores = new ContextStores();
    private final RequestCache requestCache = new RequestCache(stores);

    @Test
    void shouldCacheValuesForTheRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        // start with an empty cache
        assertThat(requestCache.get(request, "testkey")).isNull();

        assertThat(requestCache.put(request, "testkey", "testvalue")).isEqualTo("testvalue");
        assertThat(requestCache.get(request, "testkey")).isEqualTo("testvalue");

        // change the cached value
        assertThat(requestCache.put(request, "testkey", "testvalue2")).isEqualTo("testvalue2");
        assertThat(requestCache.get(request, "testkey")).isEqualTo("testvalue2");
    }

    @Test
    void valuesAreNamespacedInTheRequestStore() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        requestCache.put(request, "testkey", "v");

        assertThat(stores.storeFor(request).keys()).containsExactly(RequestCache.NAMESPACE + "testkey");
    }

    @Test
    void requestsDoNotShareValues() {
        MockHttpServletRequest first = new MockHttpServletRequest();
        MockHttpServletRequest second = new MockHttpServletRequest();

        requestCache.put(first, "testkey", "v");

        assertThat(requestCache.get(second, "testkey")).isNull();
    }

    @Test
    void nullRequestOrValueIsNotStored() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        assertThat(requestCache.put(null, "testkey", "v")).isEqualTo("v");
        assertThat(requestCache.get(null, "testkey")).isNull();
        assertThat(requestCache.put(request, "testkey", (String) null)).isNull();
        assertThat(stores.storeFor(request).size()).isZero();
    }
}
