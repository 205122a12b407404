package com.jasmin.rateguard.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.rateguard.constants.KeyManager;
import com.jasmin.rateguard.exceptions.StoreUnavailableException;
import com.jasmin.rateguard.models.RateLimitRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rules kept as JSON documents in a Redis hash, one field per route type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rate-limiting", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisRuleSource implements RuleSource {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    @Override
    public List<RateLimitRule> list() {
        Map<Object, Object> entries;
        try {
            entries = redis.opsForHash().entries(KeyManager.RULES_HASH);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load rate limit rules", e);
        }

        List<RateLimitRule> rules = new ArrayList<>(entries.size());
        for (Map.Entry<Object, Object> e : entries.entrySet()) {
            try {
                rules.add(objectMapper.readValue(e.getValue().toString(), RateLimitRule.class));
            } catch (JsonProcessingException ex) {
                log.error("Skipping unreadable rate limit rule {}", e.getKey(), ex);
            }
        }
        return rules;
    }

    @Override
    public void upsert(RateLimitRule rule) {
        String json;
        try {
            json = objectMapper.writeValueAsString(rule);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Rule cannot be serialized: " + rule.getRouteType(), e);
        }
        try {
            redis.opsForHash().put(KeyManager.RULES_HASH, rule.getRouteType(), json);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to store rate limit rule " + rule.getRouteType(), e);
        }
    }

    @Override
    public void delete(String routeType) {
        try {
            redis.opsForHash().delete(KeyManager.RULES_HASH, routeType);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to delete rate limit rule " + routeType, e);
        }
    }
}
