package com.jasmin.rateguard.services;

import com.jasmin.rateguard.config.AutoBlockConfig;
import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.constants.Constants;
import com.jasmin.rateguard.constants.KeyManager;
import com.jasmin.rateguard.models.AdmissionResult;
import com.jasmin.rateguard.models.BlockedIP;
import com.jasmin.rateguard.models.RateLimitRule;
import com.jasmin.rateguard.models.RateLimitStatus;
import com.jasmin.rateguard.models.ViolationEvent;
import com.jasmin.rateguard.sinks.ViolationSink;
import com.jasmin.rateguard.store.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-request admission decision: standing blocks first, then the resolved rule's window.
 * Never throws; an internal failure admits the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionService {

    private final RuleStore ruleStore;
    private final WindowTracker windowTracker;
    private final BlockListService blockList;
    private final MetricsAggregator metrics;
    private final List<ViolationSink> violationSinks;
    private final CounterStore store;
    private final RateLimitProperties props;
    private final Clock clock;

    public AdmissionResult admit(String clientAddress, String routeType, String path) {
        String ip = nullSafe(clientAddress);
        try {
            if (!props.isEnabled()) {
                return AdmissionResult.allow(AdmissionResult.Decision.LIMITER_DISABLED);
            }

            Optional<BlockedIP> block = blockList.activeBlock(ip);
            if (block.isPresent()) {
                log.debug("Rejected {} on {}: address is blocked", ip, path);
                metrics.recordRequest(ip, routeType, false);
                return AdmissionResult.ipBlocked(block.get().isPermanent() ? null : block.get().getExpiresAt());
            }

            Optional<RateLimitRule> resolved = ruleStore.resolveRule(routeType, path);
            if (resolved.isEmpty()) {
                metrics.recordRequest(ip, routeType, true);
                return AdmissionResult.allow(AdmissionResult.Decision.NO_RULE);
            }

            RateLimitRule rule = resolved.get();
            if (!rule.isEnabled()) {
                metrics.recordRequest(ip, rule.getRouteType(), true);
                return AdmissionResult.allow(AdmissionResult.Decision.RULE_DISABLED);
            }

            RateLimitStatus status = windowTracker.checkAndIncrement(ip, rule);
            AdmissionResult result = AdmissionResult.counted(status, rule);
            metrics.recordRequest(ip, rule.getRouteType(), result.isAllowed());

            if (!result.isAllowed()) {
                try {
                    recordViolation(ip, rule, path);
                } catch (RuntimeException e) {
                    log.warn("Failed to record violation of {} by {}", rule.getRouteType(), ip, e);
                }
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Admission check failed for {} on {}, admitting", ip, path, e);
            return AdmissionResult.allow(AdmissionResult.Decision.FAIL_OPEN);
        }
    }

    private void recordViolation(String ip, RateLimitRule rule, String path) {
        ViolationEvent event = new ViolationEvent(ip, rule.getRouteType(), path, clock.instant());
        for (ViolationSink sink : violationSinks) {
            try {
                sink.onViolation(event);
            } catch (RuntimeException e) {
                log.warn("Violation sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }

        AutoBlockConfig autoBlock = props.getAutoBlock();
        if (!autoBlock.isEnabled()) {
            return;
        }
        long violations = store.increment(KeyManager.violationsKey(ip), autoBlock.getViolationWindow());
        if (violations >= autoBlock.getViolationThreshold()) {
            blockList.block(ip, autoBlock.getBlockMinutes(), autoBlock.getReason(), false,
                    Map.of("source", Constants.AUTO_BLOCK_SOURCE,
                            "routeType", rule.getRouteType(),
                            "violations", Long.toString(violations)));
            store.delete(KeyManager.violationsKey(ip));
        }
    }

    private static String nullSafe(String s) {
        return (s == null || s.isBlank()) ? "unknown" : s;
    }
}
