package com.jasmin.rateguard.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared cache and counter store with per-key TTL.
 * <p>
 * Implementations throw {@link com.jasmin.rateguard.exceptions.StoreUnavailableException}
 * when the backing store cannot be reached. Callers decide whether to fail open or closed.
 */
public interface CounterStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    void deleteAll(Collection<String> keys);

    /**
     * Atomically increments a counter. The TTL is applied when the counter is created,
     * so it measures time since the first increment.
     */
    long increment(String key, Duration ttl);

    void addToSet(String key, String member, Duration ttl);

    Set<String> members(String key);

    void incrementScore(String key, String member, Duration ttl);

    Map<String, Long> scores(String key);

    void putHash(String key, String field, String value);

    Optional<String> getHash(String key, String field);

    Map<String, String> hashEntries(String key);

    /** @return true if the field existed */
    boolean deleteHash(String key, String field);

    /**
     * Counts one request against the fixed window stored under {@code key}, as a single
     * atomic step: if no window exists or {@code now} is not before its end, a new window
     * {@code [now - lookBack, now + window)} is opened with a zero count and
     * {@code maxRequests} captured; the count is then incremented. The window entry
     * expires at its end.
     */
    WindowCounter incrementWindow(String key, Instant now, Duration window, Duration lookBack, int maxRequests);

    /** Reads the live window without counting; empty once the window has ended. */
    Optional<WindowCounter> getWindow(String key, Instant now);

    /** Drops expired entries for stores that do not expire keys on their own. */
    default int evictExpired() {
        return 0;
    }
}
