package com.jasmin.rateguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RateLimitMetrics {
    private long totalRequests;
    private long blockedRequests;
    private long uniqueIPs;
    private List<Violator> topViolators;
    private Map<String, RouteStats> routeStats;
    private String timeRange;

    public static RateLimitMetrics empty(int hours) {
        return new RateLimitMetrics(0, 0, 0, List.of(), new LinkedHashMap<>(), hours + " hours");
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Violator {
        private String ip;
        private long violations;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class RouteStats {
        private long requests;
        private long blocks;
    }
}
