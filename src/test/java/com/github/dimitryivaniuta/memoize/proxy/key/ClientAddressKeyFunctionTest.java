package com.github.dimitryivaniuta.memoize.proxy.key;

import com.github.dimitryivaniuta.memoize.proxy.DoNotCache;
import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.proxy.support.CallableDescriptor;
import com.github.dimitryivaniuta.memoize.proxy.support.ParameterList;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientAddressKeyFunctionTest {

    private final KeyFunction keys = new ClientAddressKeyFunction(TestEncoders.deterministic());

    private static MockHttpServletRequest request(String user, String addr) {
        MockHttpServletRequest r = new MockHttpServletRequest();
        r.setRemoteAddr(addr);
        if (user != null) r.setUserPrincipal(() -> user);
        return r;
    }

    @Test
    void requestAsFirstArgumentIgnoresOtherArguments() {
        CallableDescriptor f = CallableDescriptor.forFunction("web", "page", ParameterList.ofNames("request", "page"));
        MockHttpServletRequest req = request("alice", "10.0.0.1");

        assertThat(keys.key(f, CallArguments.of(req, 1), DoNotCache.MARKER))
                .isEqualTo(keys.key(f, CallArguments.of(req, 2), DoNotCache.MARKER))
                .isEqualTo("web:page:[\"alice\",\"10.0.0.1\"]");
    }

    @Test
    void differentUsersOrAddressesGetDifferentKeys() {
        CallableDescriptor f = CallableDescriptor.forFunction("web", "page", ParameterList.ofNames("request"));

        Object alice = keys.key(f, CallArguments.of(request("alice", "10.0.0.1")), DoNotCache.MARKER);
        Object bob = keys.key(f, CallArguments.of(request("bob", "10.0.0.1")), DoNotCache.MARKER);
        Object aliceElsewhere = keys.key(f, CallArguments.of(request("alice", "10.0.0.2")), DoNotCache.MARKER);
        Object anonymous = keys.key(f, CallArguments.of(request(null, "10.0.0.1")), DoNotCache.MARKER);

        assertThat(alice).isNotEqualTo(bob).isNotEqualTo(aliceElsewhere).isNotEqualTo(anonymous);
    }

    @Test
    void requestFoundByNameWhenNotFirst() {
        CallableDescriptor f = CallableDescriptor.forFunction("web", "page", ParameterList.ofNames("page", "request"));
        MockHttpServletRequest req = request("alice", "10.0.0.1");

        assertThat(keys.key(f, CallArguments.of(7).with("request", req), DoNotCache.MARKER))
                .isEqualTo("web:page:[\"alice\",\"10.0.0.1\"]");
    }

    @Test
    void forwardedForHeaderWins() {
        CallableDescriptor f = CallableDescriptor.forFunction("web", "page", ParameterList.ofNames("request"));
        MockHttpServletRequest req = request("alice", "10.0.0.1");
        req.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");

        assertThat(keys.key(f, CallArguments.of(req), DoNotCache.MARKER))
                .isEqualTo("web:page:[\"alice\",\"203.0.113.9\"]");
    }

    @Test
    void customClientContextIsAccepted() {
        CallableDescriptor f = CallableDescriptor.forFunction("web", "page", ParameterList.ofNames("request"));
        ClientContext ctx = new ClientContext() {
            @Override
            public Object userId() {
                return 42;
            }

            @Override
            public String remoteAddress() {
                return "::1";
            }
        };

        assertThat(keys.key(f, CallArguments.of(ctx), DoNotCache.MARKER)).isEqualTo("web:page:[42,\"::1\"]");
    }

    @Test
    void missingRequestIsRejected() {
        CallableDescriptor f = CallableDescriptor.forFunction("web", "page", ParameterList.ofNames("page"));

        assertThatThrownBy(() -> keys.key(f, CallArguments.of(1), DoNotCache.MARKER))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
