package com.github.dimitryivaniuta.memoize.proxy;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "memoize")
public class MemoizeProperties {
    private boolean enabled = true;

    // used by @Memoize methods that do not set ttlSeconds
    private long defaultTtlSeconds = 900;

    // backend key namespace: "<keyPrefix>:<version>:<key>"
    private String keyPrefix = "";
    private int version = 1;

    private long maximumSize = 50_000;

    // don't wrap infrastructure / JDK
    private List<String> excludePackages = List.of(
            "org.springframework",
            "jakarta",
            "java",
            "com.fasterxml"
    );
}
