package com.jasmin.rateguard.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.constants.KeyManager;
import com.jasmin.rateguard.models.RateLimitMetrics;
import com.jasmin.rateguard.store.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Request and violation counters in hourly buckets, summed on demand over the last N hours.
 * Computed metrics are cached separately from the raw buckets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsAggregator {

    private static final DateTimeFormatter HOUR_FMT = DateTimeFormatter.ofPattern("yyyyMMddHH");

    private static final String TOTAL = "total";
    private static final String BLOCKED = "blocked";
    private static final String IPS = "ips";
    private static final String VIOLATORS = "violators";
    private static final String ROUTES = "routes";
    private static final String REQUESTS = "requests";
    private static final String BLOCKS = "blocks";
    private static final String UNCLASSIFIED = "unclassified";

    private final CounterStore store;
    private final RateLimitProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void recordRequest(String ip, String routeType, boolean allowed) {
        String bucket = hourBucket(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        String route = routeType == null || routeType.isBlank() ? UNCLASSIFIED : routeType;
        // keep the bucket alive one hour past the retention horizon
        Duration ttl = props.metricsRetention().plusHours(1);

        try {
            store.increment(KeyManager.metricsKey(bucket, TOTAL), ttl);
            store.addToSet(KeyManager.metricsKey(bucket, IPS), ip, ttl);
            store.addToSet(KeyManager.metricsKey(bucket, ROUTES), route, ttl);
            store.increment(KeyManager.routeMetricsKey(bucket, route, REQUESTS), ttl);
            if (!allowed) {
                store.increment(KeyManager.metricsKey(bucket, BLOCKED), ttl);
                store.increment(KeyManager.routeMetricsKey(bucket, route, BLOCKS), ttl);
                store.incrementScore(KeyManager.metricsKey(bucket, VIOLATORS), ip, ttl);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record rate limit metrics for {}", ip, e);
        }
    }

    /**
     * Metrics over the last {@code hours} hours, including the current one. {@code hours} is
     * clamped to the retention window.
     */
    public RateLimitMetrics getMetrics(int hours) {
        int span = Math.max(1, Math.min(hours, props.getMetricsRetentionHours()));
        String cacheKey = KeyManager.metricsCacheKey(span);

        Optional<RateLimitMetrics> cached = readCache(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        RateLimitMetrics metrics;
        try {
            metrics = calculate(span);
        } catch (RuntimeException e) {
            log.error("Error calculating rate limiting metrics", e);
            return RateLimitMetrics.empty(span);
        }

        try {
            store.set(cacheKey, objectMapper.writeValueAsString(metrics), props.getMetricsCacheTtl());
        } catch (Exception e) {
            log.warn("Failed to cache rate limiting metrics", e);
        }
        return metrics;
    }

    private RateLimitMetrics calculate(int hours) {
        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        long total = 0;
        long blocked = 0;
        Set<String> ips = new HashSet<>();
        Map<String, Long> violations = new HashMap<>();
        Map<String, RateLimitMetrics.RouteStats> routeStats = new TreeMap<>();

        for (int i = 0; i < hours; i++) {
            String bucket = hourBucket(now.minusHours(i));
            total += readLong(KeyManager.metricsKey(bucket, TOTAL));
            blocked += readLong(KeyManager.metricsKey(bucket, BLOCKED));
            ips.addAll(store.members(KeyManager.metricsKey(bucket, IPS)));
            store.scores(KeyManager.metricsKey(bucket, VIOLATORS)).forEach((ip, n) -> violations.merge(ip, n, Long::sum));

            for (String route : store.members(KeyManager.metricsKey(bucket, ROUTES))) {
                RateLimitMetrics.RouteStats stats = routeStats.computeIfAbsent(route, r -> new RateLimitMetrics.RouteStats());
                stats.setRequests(stats.getRequests() + readLong(KeyManager.routeMetricsKey(bucket, route, REQUESTS)));
                stats.setBlocks(stats.getBlocks() + readLong(KeyManager.routeMetricsKey(bucket, route, BLOCKS)));
            }
        }

        List<RateLimitMetrics.Violator> top = violations.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(props.getTopViolators())
                .map(e -> new RateLimitMetrics.Violator(e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        return new RateLimitMetrics(total, blocked, ips.size(), top, new LinkedHashMap<>(routeStats), hours + " hours");
    }

    private Optional<RateLimitMetrics> readCache(String key) {
        try {
            Optional<String> json = store.get(key);
            if (json.isPresent()) {
                return Optional.of(objectMapper.readValue(json.get(), RateLimitMetrics.class));
            }
        } catch (Exception e) {
            log.warn("Ignoring unreadable metrics cache entry {}", key, e);
        }
        return Optional.empty();
    }

    private long readLong(String key) {
        return store.get(key).map(v -> {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                return 0L;
            }
        }).orElse(0L);
    }

    private static String hourBucket(LocalDateTime time) {
        return time.format(HOUR_FMT);
    }
}
