package com.jasmin.rateguard.rules;

import com.jasmin.rateguard.models.RateLimitRule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "rate-limiting", name = "store", havingValue = "memory")
public class InMemoryRuleSource implements RuleSource {

    private final Map<String, RateLimitRule> rules = new ConcurrentHashMap<>();

    @Override
    public List<RateLimitRule> list() {
        List<RateLimitRule> out = new ArrayList<>();
        rules.values().forEach(r -> out.add(r.toBuilder().build()));
        return out;
    }

    @Override
    public void upsert(RateLimitRule rule) {
        rules.put(rule.getRouteType(), rule.toBuilder().build());
    }

    @Override
    public void delete(String routeType) {
        rules.remove(routeType);
    }
}
