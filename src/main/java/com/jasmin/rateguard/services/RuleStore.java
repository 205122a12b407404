package com.jasmin.rateguard.services;

import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.exceptions.InvalidRuleException;
import com.jasmin.rateguard.exceptions.RuleNotFoundException;
import com.jasmin.rateguard.models.RateLimitRule;
import com.jasmin.rateguard.models.RuleUpdate;
import com.jasmin.rateguard.rules.RuleSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * In-memory snapshot of the active rate limit rules, keyed by route type.
 * <p>
 * Reads go against an immutable snapshot that is swapped as a whole on refresh and on every
 * mutation, so a change is visible to the next request as soon as the mutating call returns.
 */
@Slf4j
@Service
public class RuleStore {

    private static final Comparator<RateLimitRule> BY_PRIORITY = Comparator
            .comparingInt(RateLimitRule::getPriority)
            .thenComparing(RateLimitRule::getRouteType, Comparator.reverseOrder());

    private final RuleSource ruleSource;
    private final RateLimitProperties props;
    private final Clock clock;

    private final Object mutationLock = new Object();
    private volatile Map<String, RateLimitRule> snapshot = Map.of();

    public RuleStore(RuleSource ruleSource, RateLimitProperties props, Clock clock) {
        this.ruleSource = ruleSource;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Writes the configured seed rules when the rule source holds none.
     *
     * @return number of rules seeded
     */
    public int seedIfEmpty() {
        synchronized (mutationLock) {
            if (!ruleSource.list().isEmpty()) {
                return 0;
            }
            return writeSeedRules();
        }
    }

    /**
     * Reloads the snapshot from the rule source, seeding it first if it came back empty.
     * Invalid stored rules are skipped. On failure the previous snapshot stays in place.
     *
     * @return true if the snapshot was replaced
     */
    public boolean refreshRules() {
        synchronized (mutationLock) {
            List<RateLimitRule> rules;
            try {
                rules = ruleSource.list();
                if (rules.isEmpty() && writeSeedRules() > 0) {
                    rules = ruleSource.list();
                }
            } catch (RuntimeException e) {
                log.warn("Rate limit rule refresh failed, keeping {} cached rules", snapshot.size(), e);
                return false;
            }

            Map<String, RateLimitRule> next = new LinkedHashMap<>();
            for (RateLimitRule rule : rules) {
                RateLimitRule loaded = normalize(rule);
                try {
                    validate(loaded);
                } catch (InvalidRuleException e) {
                    log.warn("Ignoring stored rate limit rule {} ({}): {}", loaded.getRouteType(), loaded.getId(), e.getMessage());
                    continue;
                }
                next.put(loaded.getRouteType(), loaded);
            }
            snapshot = Collections.unmodifiableMap(next);
            log.info("Loaded {} rate limit rules", next.size());
            return true;
        }
    }

    /**
     * Picks the single rule that governs a request: an enabled rule for the exact route type,
     * else the highest-priority enabled rule with a strict path prefixing {@code path}, else the
     * enabled default rule unless {@code path} is one of its exempt paths.
     */
    public Optional<RateLimitRule> resolveRule(String routeType, String path) {
        Map<String, RateLimitRule> rules = snapshot;
        String p = path == null ? "" : path;

        RateLimitRule exact = routeType == null ? null : rules.get(routeType);
        if (exact != null && exact.isEnabled()) {
            return Optional.of(exact);
        }

        Optional<RateLimitRule> strict = rules.values().stream()
                .filter(RateLimitRule::isEnabled)
                .filter(r -> startsWithAny(p, r.getStrictPaths()))
                .max(BY_PRIORITY);
        if (strict.isPresent()) {
            return strict;
        }

        RateLimitRule fallback = rules.get(props.getDefaultRouteType());
        if (fallback != null && fallback.isEnabled() && !startsWithAny(p, fallback.getExemptPaths())) {
            return Optional.of(fallback);
        }
        return Optional.empty();
    }

    public List<RateLimitRule> listRules() {
        List<RateLimitRule> rules = new ArrayList<>(snapshot.values());
        rules.sort(BY_PRIORITY.reversed());
        return rules;
    }

    public Optional<RateLimitRule> getRule(String routeType) {
        return Optional.ofNullable(snapshot.get(routeType));
    }

    public RateLimitRule createRule(RateLimitRule request) {
        RateLimitRule rule = normalize(request.toBuilder().build());
        validate(rule);

        synchronized (mutationLock) {
            if (snapshot.containsKey(rule.getRouteType())) {
                throw new InvalidRuleException("A rule for route type '" + rule.getRouteType() + "' already exists");
            }
            Instant now = clock.instant();
            rule.setId(newRuleId());
            rule.setCreatedAt(now);
            rule.setUpdatedAt(now);

            ruleSource.upsert(rule);
            put(rule);
        }
        log.info("Created rate limit rule {} ({} requests / {} min)",
                rule.getRouteType(), rule.getMaxRequests(), rule.getWindowMinutes());
        return rule;
    }

    public RateLimitRule updateRule(String routeType, RuleUpdate update) {
        synchronized (mutationLock) {
            RateLimitRule existing = snapshot.get(routeType);
            if (existing == null) {
                throw new RuleNotFoundException(routeType);
            }

            RateLimitRule merged = existing.toBuilder().build();
            if (update.getMaxRequests() != null) merged.setMaxRequests(update.getMaxRequests());
            if (update.getWindowMinutes() != null) merged.setWindowMinutes(update.getWindowMinutes());
            if (update.getEnabled() != null) merged.setEnabled(update.getEnabled());
            if (update.getPriority() != null) merged.setPriority(update.getPriority());
            if (update.getExemptPaths() != null) merged.setExemptPaths(new ArrayList<>(update.getExemptPaths()));
            if (update.getStrictPaths() != null) merged.setStrictPaths(new ArrayList<>(update.getStrictPaths()));
            merged.setUpdatedAt(clock.instant());
            validate(merged);

            ruleSource.upsert(merged);
            put(merged);
            log.info("Updated rate limit rule {}", routeType);
            return merged;
        }
    }

    public void deleteRule(String routeType) {
        synchronized (mutationLock) {
            if (!snapshot.containsKey(routeType)) {
                throw new RuleNotFoundException(routeType);
            }
            ruleSource.delete(routeType);

            Map<String, RateLimitRule> next = new LinkedHashMap<>(snapshot);
            next.remove(routeType);
            snapshot = Collections.unmodifiableMap(next);
        }
        log.info("Deleted rate limit rule {}", routeType);
    }

    private void put(RateLimitRule rule) {
        Map<String, RateLimitRule> next = new LinkedHashMap<>(snapshot);
        next.put(rule.getRouteType(), rule);
        snapshot = Collections.unmodifiableMap(next);
    }

    private int writeSeedRules() {
        if (props.getSeedRules().isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        for (RateLimitRule seed : props.getSeedRules()) {
            RateLimitRule rule = normalize(seed.toBuilder().build());
            validate(rule);
            rule.setId(StringUtils.hasText(rule.getId()) ? rule.getId() : newRuleId());
            rule.setCreatedAt(now);
            rule.setUpdatedAt(now);
            ruleSource.upsert(rule);
        }
        log.info("Seeded {} rate limit rules", props.getSeedRules().size());
        return props.getSeedRules().size();
    }

    private void validate(RateLimitRule rule) {
        if (!StringUtils.hasText(rule.getRouteType())) {
            throw new InvalidRuleException("routeType is required");
        }
        if (rule.getMaxRequests() < 0 || rule.getWindowMinutes() < 0) {
            throw new InvalidRuleException("maxRequests and windowMinutes must not be negative");
        }
        if (rule.isEnabled() && (rule.getMaxRequests() <= 0 || rule.getWindowMinutes() <= 0)) {
            throw new InvalidRuleException("An enabled rule needs positive maxRequests and windowMinutes");
        }
    }

    private static RateLimitRule normalize(RateLimitRule rule) {
        rule.setExemptPaths(rule.getExemptPaths() == null ? new ArrayList<>() : new ArrayList<>(rule.getExemptPaths()));
        rule.setStrictPaths(rule.getStrictPaths() == null ? new ArrayList<>() : new ArrayList<>(rule.getStrictPaths()));
        return rule;
    }

    private static boolean startsWithAny(String path, List<String> prefixes) {
        if (prefixes == null) {
            return false;
        }
        for (String prefix : prefixes) {
            if (StringUtils.hasText(prefix) && path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String newRuleId() {
        return "rule_" + UUID.randomUUID();
    }
}
