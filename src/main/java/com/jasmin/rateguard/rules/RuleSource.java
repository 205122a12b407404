package com.jasmin.rateguard.rules;

import com.jasmin.rateguard.models.RateLimitRule;

import java.util.List;

/**
 * Authoritative, persistent set of rate limit rules, keyed by route type.
 */
public interface RuleSource {

    List<RateLimitRule> list();

    void upsert(RateLimitRule rule);

    void delete(String routeType);
}
