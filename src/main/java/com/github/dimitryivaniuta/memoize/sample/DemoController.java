package com.github.dimitryivaniuta.memoize.sample;

import com.github.dimitryivaniuta.memoize.proxy.MemoizationRegistry;
import com.github.dimitryivaniuta.memoize.proxy.context.RequestCache;
import com.github.dimitryivaniuta.memoize.proxy.support.CallArguments;
import com.github.dimitryivaniuta.memoize.sample.dto.DemoClientResponse;
import com.github.dimitryivaniuta.memoize.sample.dto.DemoClientView;
import com.github.dimitryivaniuta.memoize.sample.dto.DemoCustomerView;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/demo")
public class DemoController {

    private final DemoService demoService;
    private final MemoizationRegistry registry;
    private final RequestCache requestCache;

    @GetMapping("/cache")
    public DemoCustomerView cache(@RequestParam @NotNull Long customerId,
                                  @RequestParam(defaultValue = "false") boolean detailed) {
        return demoService.customerView(customerId, detailed);
    }

    @DeleteMapping("/cache/{customerId}")
    public ResponseEntity<Void> evict(@PathVariable Long customerId) {
        // detailed falls back to its @MemoDefault
        registry.function(DemoService.class, "customerView").delete(CallArguments.of(customerId));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/client")
    public DemoClientResponse client(HttpServletRequest request) {
        DemoClientView first = demoService.clientView(request);
        DemoClientView second = demoService.clientView(request);

        String greeting = (String) requestCache.get(request, "greeting");
        if (greeting == null) {
            greeting = requestCache.put(request, "greeting", "hello " + first.remoteAddress());
        }
        return new DemoClientResponse(first, second, greeting);
    }
}
