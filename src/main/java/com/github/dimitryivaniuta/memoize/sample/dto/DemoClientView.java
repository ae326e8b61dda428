package com.github.dimitryivaniuta.memoize.sample.dto;

import java.time.Instant;

public record DemoClientView(String userId, String remoteAddress, String token, Instant computedAt) {}
