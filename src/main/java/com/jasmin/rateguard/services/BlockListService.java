package com.jasmin.rateguard.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.rateguard.constants.Constants;
import com.jasmin.rateguard.constants.KeyManager;
import com.jasmin.rateguard.exceptions.StoreUnavailableException;
import com.jasmin.rateguard.models.BlockedIP;
import com.jasmin.rateguard.store.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Explicit per-address blocks, independent of the window counters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockListService {

    private final CounterStore store;
    private final WindowTracker windowTracker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BlockedIP block(String ip, int durationMinutes, String reason) {
        return block(ip, durationMinutes, reason, false, Map.of("source", Constants.MANUAL_BLOCK_SOURCE));
    }

    public BlockedIP blockPermanently(String ip, String reason) {
        return block(ip, 0, reason, true, Map.of("source", Constants.MANUAL_BLOCK_SOURCE));
    }

    /**
     * Creates or replaces the block of {@code ip}. A replaced block carries its attempt count forward.
     * The address's window counters are cleared so it starts with a clean budget once released.
     */
    public BlockedIP block(String ip, int durationMinutes, String reason, boolean permanent, Map<String, String> metadata) {
        if (!StringUtils.hasText(ip)) {
            throw new IllegalArgumentException("ip is required");
        }
        if (!permanent && durationMinutes <= 0) {
            throw new IllegalArgumentException("durationMinutes must be positive");
        }

        Instant now = clock.instant();
        int previousAttempts = readBlock(ip).map(BlockedIP::getAttempts).orElse(0);

        BlockedIP blocked = BlockedIP.builder()
                .id("block_" + UUID.randomUUID())
                .ipAddress(ip)
                .reason(StringUtils.hasText(reason) ? reason : Constants.MANUAL_BLOCK_REASON)
                .blockedAt(now)
                .expiresAt(permanent ? null : now.plus(Duration.ofMinutes(durationMinutes)))
                .permanent(permanent)
                .attempts(previousAttempts + 1)
                .metadata(new HashMap<>(metadata))
                .build();

        store.putHash(KeyManager.BLOCKS_HASH, ip, toJson(blocked));
        windowTracker.clearStatus(ip);

        if (permanent) {
            log.info("Blocked {} permanently: {}", ip, blocked.getReason());
        } else {
            log.info("Blocked {} until {}: {}", ip, blocked.getExpiresAt(), blocked.getReason());
        }
        return blocked;
    }

    /**
     * Removes the block of {@code ip} and clears its window counters. Unblocking an address
     * that is not blocked is a no-op.
     *
     * @return true if a block was removed
     */
    public boolean unblock(String ip) {
        boolean removed = store.deleteHash(KeyManager.BLOCKS_HASH, ip);
        windowTracker.clearStatus(ip);
        if (removed) {
            log.info("Unblocked {}", ip);
        }
        return removed;
    }

    /**
     * Whether {@code ip} has a standing block. Fails open when the store is unreachable.
     */
    public boolean isBlocked(String ip) {
        return activeBlock(ip).isPresent();
    }

    /**
     * The block of {@code ip} if it is still in force. Empty when the store is unreachable.
     */
    public Optional<BlockedIP> activeBlock(String ip) {
        if (ip == null) {
            return Optional.empty();
        }
        try {
            Instant now = clock.instant();
            return readBlock(ip).filter(b -> b.isActiveAt(now));
        } catch (StoreUnavailableException e) {
            log.warn("Block list lookup failed for {}, admitting", ip, e);
            return Optional.empty();
        }
    }

    public Optional<BlockedIP> getBlock(String ip) {
        return readBlock(ip);
    }

    public List<BlockedIP> listBlocked() {
        List<BlockedIP> out = new ArrayList<>();
        for (Map.Entry<String, String> e : store.hashEntries(KeyManager.BLOCKS_HASH).entrySet()) {
            BlockedIP b = fromJson(e.getKey(), e.getValue());
            if (b != null) {
                out.add(b);
            }
        }
        out.sort(Comparator.comparing(BlockedIP::getBlockedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return out;
    }

    /**
     * Releases every non-permanent block whose expiry has passed.
     *
     * @return number of released blocks
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int released = 0;
        for (BlockedIP b : listBlocked()) {
            if (b.isPermanent() || b.getExpiresAt() == null || b.getExpiresAt().isAfter(now)) {
                continue;
            }
            try {
                unblock(b.getIpAddress());
                released++;
            } catch (RuntimeException e) {
                log.error("Failed to release expired block of {}", b.getIpAddress(), e);
            }
        }
        if (released > 0) {
            log.info("Released {} expired IP blocks", released);
        }
        return released;
    }

    private Optional<BlockedIP> readBlock(String ip) {
        return store.getHash(KeyManager.BLOCKS_HASH, ip).map(json -> fromJson(ip, json));
    }

    private String toJson(BlockedIP blocked) {
        try {
            return objectMapper.writeValueAsString(blocked);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize block of " + blocked.getIpAddress(), e);
        }
    }

    private BlockedIP fromJson(String ip, String json) {
        try {
            return objectMapper.readValue(json, BlockedIP.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable block entry for {}", ip, e);
            return null;
        }
    }
}
