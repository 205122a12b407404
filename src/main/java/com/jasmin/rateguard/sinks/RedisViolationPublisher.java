package com.jasmin.rateguard.sinks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.rateguard.constants.KeyManager;
import com.jasmin.rateguard.models.ViolationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes violations on a Redis channel for audit consumers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rate-limiting", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisViolationPublisher implements ViolationSink {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void onViolation(ViolationEvent event) {
        Map<String, Object> message = new HashMap<>();
        message.put("ip", event.getIp());
        message.put("routeType", event.getRouteType());
        message.put("path", event.getPath());
        message.put("timestamp", event.getTimestamp().toString());

        try {
            redisTemplate.convertAndSend(KeyManager.VIOLATION_CHANNEL, objectMapper.writeValueAsString(message));
        } catch (Exception e) {
            log.error("Failed to publish rate limit violation for {}", event.getIp(), e);
        }
    }
}
