package com.github.dimitryivaniuta.memoize.proxy.key;

import jakarta.servlet.http.HttpServletRequest;

import java.security.Principal;

/**
 * {@link ClientContext} view of a servlet request.
 */
public record ServletClientContext(HttpServletRequest request) implements ClientContext {

    @Override
    public Object userId() {
        Principal p = request.getUserPrincipal();
        return (p == null || p.getName() == null || p.getName().isBlank()) ? null : p.getName();
    }

    @Override
    public String remoteAddress() {
        // X-Forwarded-For may contain "client, proxy1, proxy2"
        String xff = header("X-Forwarded-For");
        if (xff != null) {
            int comma = xff.indexOf(',');
            String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
            if (!first.isBlank()) return first;
        }
        String realIp = header("X-Real-IP");
        if (realIp != null) return realIp;

        String ra = request.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? null : ra;
    }

    private String header(String name) {
        String v = request.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
