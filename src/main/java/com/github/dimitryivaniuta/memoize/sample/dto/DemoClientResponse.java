package com.github.dimitryivaniuta.memoize.sample.dto;

public record DemoClientResponse(DemoClientView first, DemoClientView second, String greeting) {}
