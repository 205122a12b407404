package com.jasmin.rateguard.constants;

/**
 * Key layout of everything the rate limiter keeps in the counter store.
 * Client addresses are wrapped in braces so that one address is never a
 * key prefix of another (IPv6) and all keys of an address share a hash slot.
 */
public class KeyManager {
    public static final String RULES_HASH = "rl:rules";
    public static final String BLOCKS_HASH = "rl:blocks";
    public static final String VIOLATION_CHANNEL = "rl:violations";

    public static String statusKey(String ip, String routeType) {
        return "rl:status:{" + ip + "}:" + routeType;
    }

    public static String violationsKey(String ip) {
        return "rl:violations:{" + ip + "}";
    }

    public static String metricsKey(String hourBucket, String name) {
        return "rl:metrics:" + hourBucket + ":" + name;
    }

    public static String routeMetricsKey(String hourBucket, String routeType, String name) {
        return "rl:metrics:" + hourBucket + ":route:" + routeType + ":" + name;
    }

    public static String metricsCacheKey(int hours) {
        return "rl:metrics:cache:" + hours;
    }
}
