package com.jasmin.rateguard.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.models.RateLimitRule;
import com.jasmin.rateguard.rules.InMemoryRuleSource;
import com.jasmin.rateguard.services.*;
import com.jasmin.rateguard.sinks.ViolationSink;
import com.jasmin.rateguard.store.InMemoryCounterStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The limiter wired by hand on the in-memory store and a controllable clock.
 */
public class RateGuardFixture {
    public final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    public final RateLimitProperties props;
    public final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    public final InMemoryCounterStore store = new InMemoryCounterStore(clock);
    public final InMemoryRuleSource ruleSource = new InMemoryRuleSource();
    public final List<ViolationSink> sinks = new ArrayList<>();
    public final RuleStore ruleStore;
    public final WindowTracker windowTracker;
    public final BlockListService blockList;
    public final MetricsAggregator metrics;
    public final AdmissionService admission;

    public RateGuardFixture() {
        this(new RateLimitProperties());
    }

    public RateGuardFixture(RateLimitProperties props) {
        this.props = props;
        props.setStore(RateLimitProperties.StoreType.MEMORY);
        this.ruleStore = new RuleStore(ruleSource, props, clock);
        this.windowTracker = new WindowTracker(store, ruleStore, props, clock);
        this.blockList = new BlockListService(store, windowTracker, objectMapper, clock);
        this.metrics = new MetricsAggregator(store, props, objectMapper, clock);
        this.admission = new AdmissionService(ruleStore, windowTracker, blockList, metrics, sinks, store, props, clock);
    }

    public static RateLimitRule defaultRule() {
        return RateLimitRule.builder()
                .routeType("default")
                .maxRequests(100)
                .windowMinutes(1)
                .priority(1)
                .exemptPaths(new ArrayList<>(List.of("/api/directory", "/api/items", "/api/storefront", "/api/products")))
                .build();
    }

    public static RateLimitRule strictRule() {
        return RateLimitRule.builder()
                .routeType("strict")
                .maxRequests(10)
                .windowMinutes(1)
                .priority(2)
                .strictPaths(new ArrayList<>(List.of("/api/tenants")))
                .build();
    }

    public static RateLimitRule rule(String routeType, int maxRequests, int windowMinutes) {
        return RateLimitRule.builder()
                .routeType(routeType)
                .maxRequests(maxRequests)
                .windowMinutes(windowMinutes)
                .build();
    }
}
