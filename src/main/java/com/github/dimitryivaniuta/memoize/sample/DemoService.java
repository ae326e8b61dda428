package com.github.dimitryivaniuta.memoize.sample;

import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoDefault;
import com.github.dimitryivaniuta.memoize.proxy.annotations.Memoize;
import com.github.dimitryivaniuta.memoize.proxy.annotations.MemoizeInRequest;
import com.github.dimitryivaniuta.memoize.proxy.key.ClientAddressKeyFunction;
import com.github.dimitryivaniuta.memoize.proxy.key.ServletClientContext;
import com.github.dimitryivaniuta.memoize.sample.dto.DemoClientView;
import com.github.dimitryivaniuta.memoize.sample.dto.DemoCustomerView;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Service
public class DemoService {

    /**
     * TTL demo: returns a stable UUID per customerId (should remain same on repeated calls).
     */
    @Memoize(ttlSeconds = 60)
    public DemoCustomerView customerView(Long customerId, @MemoDefault("false") boolean detailed) {
        return new DemoCustomerView(
                customerId,
                UUID.randomUUID().toString() + (detailed ? ":detailed" : ""),
                Instant.now()
        );
    }

    /**
     * Request demo: one value per (user, address) for the lifetime of the request.
     */
    @MemoizeInRequest(keyFunction = ClientAddressKeyFunction.class)
    public DemoClientView clientView(HttpServletRequest request) {
        var client = new ServletClientContext(request);
        return new DemoClientView(
                Objects.toString(client.userId(), null),
                client.remoteAddress(),
                UUID.randomUUID().toString(),
                Instant.now()
        );
    }
}
