package com.jasmin.rateguard.store;

import com.jasmin.rateguard.exceptions.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rate-limiting", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisCounterStore implements CounterStore {

    private static final RedisScript<List<Object>> FIXED_WINDOW_SCRIPT = loadLuaScript("lua/fixed_window.lua");

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        return execute("get " + key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        execute("set " + key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        execute("delete " + key, () -> redis.delete(key));
    }

    @Override
    public void deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        execute("delete " + keys.size() + " keys", () -> redis.delete(keys));
    }

    @Override
    public long increment(String key, Duration ttl) {
        return execute("increment " + key, () -> {
            Long value = redis.opsForValue().increment(key);
            if (value != null && value == 1L) {
                redis.expire(key, ttl);
            }
            return value == null ? 0L : value;
        });
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        execute("sadd " + key, () -> {
            redis.opsForSet().add(key, member);
            return redis.expire(key, ttl);
        });
    }

    @Override
    public Set<String> members(String key) {
        return execute("smembers " + key, () -> {
            Set<String> members = redis.opsForSet().members(key);
            return members == null ? Set.of() : members;
        });
    }

    @Override
    public void incrementScore(String key, String member, Duration ttl) {
        execute("zincrby " + key, () -> {
            redis.opsForZSet().incrementScore(key, member, 1);
            return redis.expire(key, ttl);
        });
    }

    @Override
    public Map<String, Long> scores(String key) {
        return execute("zrange " + key, () -> {
            Set<ZSetOperations.TypedTuple<String>> tuples = redis.opsForZSet().rangeWithScores(key, 0, -1);
            Map<String, Long> out = new HashMap<>();
            if (tuples != null) {
                for (ZSetOperations.TypedTuple<String> t : tuples) {
                    if (t.getValue() != null && t.getScore() != null) {
                        out.put(t.getValue(), t.getScore().longValue());
                    }
                }
            }
            return out;
        });
    }

    @Override
    public void putHash(String key, String field, String value) {
        execute("hset " + key, () -> {
            redis.opsForHash().put(key, field, value);
            return null;
        });
    }

    @Override
    public Optional<String> getHash(String key, String field) {
        return execute("hget " + key, () -> {
            Object value = redis.opsForHash().get(key, field);
            return Optional.ofNullable(value == null ? null : value.toString());
        });
    }

    @Override
    public Map<String, String> hashEntries(String key) {
        return execute("hgetall " + key, () -> {
            Map<Object, Object> entries = redis.opsForHash().entries(key);
            Map<String, String> out = new LinkedHashMap<>();
            entries.forEach((k, v) -> out.put(k.toString(), v.toString()));
            return out;
        });
    }

    @Override
    public boolean deleteHash(String key, String field) {
        return execute("hdel " + key, () -> {
            Long removed = redis.opsForHash().delete(key, field);
            return removed != null && removed > 0;
        });
    }

    @Override
    public WindowCounter incrementWindow(String key, Instant now, Duration window, Duration lookBack, int maxRequests) {
        return execute("increment window " + key, () -> {
            List<Object> result = redis.execute(
                    FIXED_WINDOW_SCRIPT,
                    List.of(key),
                    String.valueOf(now.toEpochMilli()),
                    String.valueOf(window.toMillis()),
                    String.valueOf(lookBack.toMillis()),
                    String.valueOf(maxRequests)
            );
            if (result == null || result.size() < 4) {
                throw new IllegalStateException("Unexpected fixed window script result: " + result);
            }
            return new WindowCounter(
                    toLong(result.get(0)),
                    (int) toLong(result.get(3)),
                    Instant.ofEpochMilli(toLong(result.get(1))),
                    Instant.ofEpochMilli(toLong(result.get(2)))
            );
        });
    }

    @Override
    public Optional<WindowCounter> getWindow(String key, Instant now) {
        return execute("read window " + key, () -> {
            Map<Object, Object> h = redis.opsForHash().entries(key);
            if (h.isEmpty() || h.get("windowEnd") == null) {
                return Optional.empty();
            }
            Instant windowEnd = Instant.ofEpochMilli(toLong(h.get("windowEnd")));
            if (!now.isBefore(windowEnd)) {
                return Optional.empty();
            }
            return Optional.of(new WindowCounter(
                    toLong(h.getOrDefault("count", "0")),
                    (int) toLong(h.getOrDefault("maxRequests", "0")),
                    Instant.ofEpochMilli(toLong(h.getOrDefault("windowStart", "0"))),
                    windowEnd
            ));
        });
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + operation + " failed", e);
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    @SuppressWarnings("unchecked")
    static RedisScript<List<Object>> loadLuaScript(String path) {
        DefaultRedisScript<List<Object>> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(path));
        script.setResultType((Class<List<Object>>) (Class<?>) List.class);
        return script;
    }
}
