package com.jasmin.rateguard.services;

import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.constants.KeyManager;
import com.jasmin.rateguard.exceptions.StoreUnavailableException;
import com.jasmin.rateguard.models.RateLimitRule;
import com.jasmin.rateguard.models.RateLimitStatus;
import com.jasmin.rateguard.store.CounterStore;
import com.jasmin.rateguard.store.WindowCounter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed-window request counters per client address and route type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WindowTracker {

    private final CounterStore store;
    private final RuleStore ruleStore;
    private final RateLimitProperties props;
    private final Clock clock;

    /**
     * Counts one request from {@code clientAddress} against {@code rule}, opening a new window
     * when none is live. If the store cannot be reached the request is treated as the first of
     * an untracked window.
     */
    public RateLimitStatus checkAndIncrement(String clientAddress, RateLimitRule rule) {
        Instant now = clock.instant();
        Duration window = Duration.ofMinutes(rule.getWindowMinutes());
        Duration lookBack = props.getWindowAlignment() == RateLimitProperties.WindowAlignment.SYMMETRIC
                ? window
                : Duration.ZERO;

        try {
            WindowCounter counter = store.incrementWindow(
                    KeyManager.statusKey(clientAddress, rule.getRouteType()), now, window, lookBack, rule.getMaxRequests());
            return toStatus(clientAddress, rule.getRouteType(), counter);
        } catch (StoreUnavailableException e) {
            log.warn("Window lookup failed for {} on {}, treating as untracked", clientAddress, rule.getRouteType(), e);
            return toStatus(clientAddress, rule.getRouteType(),
                    new WindowCounter(1, rule.getMaxRequests(), now.minus(lookBack), now.plus(window)));
        }
    }

    /** Live window for the pair, without counting a request. */
    public Optional<RateLimitStatus> getStatus(String clientAddress, String routeType) {
        try {
            return store.getWindow(KeyManager.statusKey(clientAddress, routeType), clock.instant())
                    .map(counter -> toStatus(clientAddress, routeType, counter));
        } catch (StoreUnavailableException e) {
            log.warn("Window lookup failed for {} on {}", clientAddress, routeType, e);
            return Optional.empty();
        }
    }

    /**
     * Drops the address's window under every known route type so it starts over with a full
     * budget. A window of a rule deleted since it opened is left to expire at its end.
     */
    public void clearStatus(String clientAddress) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(KeyManager.statusKey(clientAddress, props.getDefaultRouteType()));
        for (RateLimitRule rule : ruleStore.listRules()) {
            keys.add(KeyManager.statusKey(clientAddress, rule.getRouteType()));
        }
        store.deleteAll(keys);
        log.debug("Cleared rate limit windows for {}", clientAddress);
    }

    private static RateLimitStatus toStatus(String clientAddress, String routeType, WindowCounter counter) {
        return RateLimitStatus.builder()
                .clientAddress(clientAddress)
                .routeType(routeType)
                .currentRequests(counter.getCount())
                .maxRequests(counter.getMaxRequests())
                .windowStart(counter.getWindowStart())
                .windowEnd(counter.getWindowEnd())
                .build();
    }
}
