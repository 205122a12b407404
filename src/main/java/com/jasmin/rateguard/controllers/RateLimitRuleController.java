package com.jasmin.rateguard.controllers;

import com.jasmin.rateguard.exceptions.RuleNotFoundException;
import com.jasmin.rateguard.models.RateLimitRule;
import com.jasmin.rateguard.models.RuleUpdate;
import com.jasmin.rateguard.services.RuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/rate-limit/rules")
@RequiredArgsConstructor
public class RateLimitRuleController {

    private final RuleStore ruleStore;

    @GetMapping
    public List<RateLimitRule> getRules() {
        return ruleStore.listRules();
    }

    @GetMapping("/{routeType}")
    public RateLimitRule getRule(@PathVariable String routeType) {
        return ruleStore.getRule(routeType).orElseThrow(() -> new RuleNotFoundException(routeType));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RateLimitRule createRule(@RequestBody RateLimitRule rule) {
        return ruleStore.createRule(rule);
    }

    @PutMapping("/{routeType}")
    public RateLimitRule updateRule(@PathVariable String routeType, @RequestBody RuleUpdate update) {
        return ruleStore.updateRule(routeType, update);
    }

    @DeleteMapping("/{routeType}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteRule(@PathVariable String routeType) {
        ruleStore.deleteRule(routeType);
    }

    @PostMapping("/refresh")
    public Map<String, Object> refreshRules() {
        log.info("Manually refreshing rate limit rules");
        boolean refreshed = ruleStore.refreshRules();
        return Map.of("refreshed", refreshed, "count", ruleStore.listRules().size());
    }
}
