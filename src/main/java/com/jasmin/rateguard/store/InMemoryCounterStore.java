package com.jasmin.rateguard.store;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process counter store. Every mutation goes through {@link ConcurrentHashMap#compute},
 * so updates of one key are atomic; expired entries are dropped on read and by {@link #evictExpired()}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "rate-limiting", name = "store", havingValue = "memory")
public class InMemoryCounterStore implements CounterStore {

    private final Clock clock;

    private final Map<String, Entry<String>> values = new ConcurrentHashMap<>();
    private final Map<String, Entry<Set<String>>> sets = new ConcurrentHashMap<>();
    private final Map<String, Entry<Map<String, Long>>> scores = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();
    private final Map<String, WindowCounter> windows = new ConcurrentHashMap<>();

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(live(values, key)).map(Entry::getValue);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        values.put(key, new Entry<>(value, expiry(ttl)));
    }

    @Override
    public void delete(String key) {
        values.remove(key);
        sets.remove(key);
        scores.remove(key);
        hashes.remove(key);
        windows.remove(key);
    }

    @Override
    public void deleteAll(Collection<String> keys) {
        keys.forEach(this::delete);
    }

    @Override
    public long increment(String key, Duration ttl) {
        Instant now = clock.instant();
        Entry<String> updated = values.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                return new Entry<>("1", now.plus(ttl));
            }
            long next = Long.parseLong(current.getValue()) + 1;
            return new Entry<>(Long.toString(next), current.getExpiresAt());
        });
        return Long.parseLong(updated.getValue());
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        Instant now = clock.instant();
        sets.compute(key, (k, current) -> {
            Set<String> members = current == null || current.isExpired(now)
                    ? ConcurrentHashMap.newKeySet()
                    : current.getValue();
            members.add(member);
            return new Entry<>(members, now.plus(ttl));
        });
    }

    @Override
    public Set<String> members(String key) {
        Entry<Set<String>> entry = live(sets, key);
        return entry == null ? Set.of() : new HashSet<>(entry.getValue());
    }

    @Override
    public void incrementScore(String key, String member, Duration ttl) {
        Instant now = clock.instant();
        scores.compute(key, (k, current) -> {
            Map<String, Long> members = current == null || current.isExpired(now)
                    ? new ConcurrentHashMap<>()
                    : current.getValue();
            members.merge(member, 1L, Long::sum);
            return new Entry<>(members, now.plus(ttl));
        });
    }

    @Override
    public Map<String, Long> scores(String key) {
        Entry<Map<String, Long>> entry = live(scores, key);
        return entry == null ? Map.of() : new HashMap<>(entry.getValue());
    }

    @Override
    public void putHash(String key, String field, String value) {
        hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(field, value);
    }

    @Override
    public Optional<String> getHash(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field));
    }

    @Override
    public Map<String, String> hashEntries(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? Map.of() : new LinkedHashMap<>(hash);
    }

    @Override
    public boolean deleteHash(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        return hash != null && hash.remove(field) != null;
    }

    @Override
    public WindowCounter incrementWindow(String key, Instant now, Duration window, Duration lookBack, int maxRequests) {
        return windows.compute(key, (k, current) -> {
            if (current == null || !now.isBefore(current.getWindowEnd())) {
                return new WindowCounter(1, maxRequests, now.minus(lookBack), now.plus(window));
            }
            return new WindowCounter(current.getCount() + 1, current.getMaxRequests(),
                    current.getWindowStart(), current.getWindowEnd());
        });
    }

    @Override
    public Optional<WindowCounter> getWindow(String key, Instant now) {
        WindowCounter counter = windows.get(key);
        if (counter == null || !now.isBefore(counter.getWindowEnd())) {
            return Optional.empty();
        }
        return Optional.of(counter);
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int before = values.size() + sets.size() + scores.size() + windows.size();
        values.values().removeIf(e -> e.isExpired(now));
        sets.values().removeIf(e -> e.isExpired(now));
        scores.values().removeIf(e -> e.isExpired(now));
        windows.values().removeIf(w -> !now.isBefore(w.getWindowEnd()));
        int evicted = before - (values.size() + sets.size() + scores.size() + windows.size());
        if (evicted > 0) {
            log.debug("Evicted {} expired counter entries", evicted);
        }
        return evicted;
    }

    private Instant expiry(Duration ttl) {
        return clock.instant().plus(ttl);
    }

    private <T> Entry<T> live(Map<String, Entry<T>> map, String key) {
        Entry<T> entry = map.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            map.remove(key, entry);
            return null;
        }
        return entry;
    }

    @Value
    private static class Entry<T> {
        T value;
        Instant expiresAt;

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
