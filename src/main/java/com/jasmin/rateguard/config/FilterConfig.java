package com.jasmin.rateguard.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
public class FilterConfig {
    private boolean enabled = true;

    /** Ant-style path patterns that are never admitted through the limiter. */
    private List<String> excludePatterns = new ArrayList<>(List.of("/api/rate-limit/**", "/actuator/**"));

    /**
     * Whether {@link #clientIpHeaders} are read at all. Off by default, so the socket address
     * is the client unless the service sits behind a known proxy.
     */
    private boolean trustForwardedHeaders = false;

    /**
     * Addresses or CIDR blocks of proxies allowed to set the forwarding headers. When empty and
     * {@link #trustForwardedHeaders} is on, every peer is trusted.
     */
    private List<String> trustedProxies = new ArrayList<>();

    /** Headers searched, in order, for the client address before the socket address. */
    private List<String> clientIpHeaders = new ArrayList<>(List.of("X-Forwarded-For", "X-Real-IP"));

    /** First matching pattern decides the route type. */
    private List<RouteMapping> routes = new ArrayList<>();

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class RouteMapping {
        private String pattern;
        private String routeType;
    }
}
