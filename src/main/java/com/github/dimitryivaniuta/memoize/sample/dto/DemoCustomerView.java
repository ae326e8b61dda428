package com.github.dimitryivaniuta.memoize.sample.dto;

import java.time.Instant;

public record DemoCustomerView(Long customerId, String stableValue, Instant computedAt) {}
