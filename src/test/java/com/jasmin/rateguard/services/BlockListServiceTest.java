package com.jasmin.rateguard.services;

import com.jasmin.rateguard.exceptions.StoreUnavailableException;
import com.jasmin.rateguard.models.BlockedIP;
import com.jasmin.rateguard.models.RateLimitRule;
import com.jasmin.rateguard.store.CounterStore;
import com.jasmin.rateguard.support.RateGuardFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.jasmin.rateguard.support.RateGuardFixture.rule;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BlockListServiceTest {

    private final RateGuardFixture fx = new RateGuardFixture();
    private final BlockListService blockList = fx.blockList;

    @Test
    void testBlock_createsExpiringEntry() {
        BlockedIP blocked = blockList.block("5.6.7.8", 60, "abuse");

        assertEquals("5.6.7.8", blocked.getIpAddress());
        assertEquals("abuse", blocked.getReason());
        assertEquals(fx.clock.instant().plus(Duration.ofMinutes(60)), blocked.getExpiresAt());
        assertFalse(blocked.isPermanent());
        assertEquals(1, blocked.getAttempts());
        assertTrue(blockList.isBlocked("5.6.7.8"));
        assertFalse(blockList.isBlocked("5.6.7.9"));
    }

    @Test
    void testActiveBlock_onlyWhileInForce() {
        blockList.block("5.6.7.8", 10, "abuse");

        assertEquals("abuse", blockList.activeBlock("5.6.7.8").orElseThrow().getReason());
        assertTrue(blockList.activeBlock("5.6.7.9").isEmpty());

        fx.clock.advance(Duration.ofMinutes(10));
        assertTrue(blockList.activeBlock("5.6.7.8").isEmpty());
        assertTrue(blockList.getBlock("5.6.7.8").isPresent());
    }

    @Test
    void testBlock_againReplacesAndCountsAttempts() {
        blockList.block("5.6.7.8", 10, "first");
        BlockedIP second = blockList.block("5.6.7.8", 30, "second");

        assertEquals(2, second.getAttempts());
        assertEquals(1, blockList.listBlocked().size());
        assertEquals("second", blockList.getBlock("5.6.7.8").orElseThrow().getReason());
    }

    @Test
    void testBlock_clearsWindowCounters() {
        RateLimitRule api = fx.ruleStore.createRule(rule("api", 3, 1));
        fx.windowTracker.checkAndIncrement("5.6.7.8", api);

        blockList.block("5.6.7.8", 60, "abuse");

        assertTrue(fx.windowTracker.getStatus("5.6.7.8", "api").isEmpty());
    }

    @Test
    void testBlock_rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> blockList.block("", 60, "x"));
        assertThrows(IllegalArgumentException.class, () -> blockList.block("1.1.1.1", 0, "x"));
    }

    @Test
    void testUnblock_removesBlockAndIsIdempotent() {
        blockList.block("5.6.7.8", 60, "abuse");

        assertTrue(blockList.unblock("5.6.7.8"));
        assertFalse(blockList.isBlocked("5.6.7.8"));
        assertFalse(blockList.unblock("5.6.7.8"));
        assertFalse(blockList.unblock("10.0.0.1"));
    }

    @Test
    void testIsBlocked_expiredEntryNoLongerBlocks() {
        blockList.block("5.6.7.8", 1, "short");

        fx.clock.advance(Duration.ofMinutes(1));

        assertFalse(blockList.isBlocked("5.6.7.8"));
        assertTrue(blockList.getBlock("5.6.7.8").isPresent(), "entry stays until swept");
    }

    @Test
    void testSweepExpired_releasesOnlyExpiredNonPermanent() {
        blockList.block("1.1.1.1", 5, "short");
        blockList.block("2.2.2.2", 120, "long");
        blockList.blockPermanently("3.3.3.3", "forever");

        fx.clock.advance(Duration.ofMinutes(5));
        assertEquals(1, blockList.sweepExpired());

        fx.clock.advance(Duration.ofDays(365));
        assertEquals(1, blockList.sweepExpired());

        List<BlockedIP> remaining = blockList.listBlocked();
        assertEquals(1, remaining.size());
        assertEquals("3.3.3.3", remaining.get(0).getIpAddress());
        assertTrue(blockList.isBlocked("3.3.3.3"));
        assertNull(remaining.get(0).getExpiresAt());
    }

    @Test
    void testListBlocked_newestFirst() {
        blockList.block("1.1.1.1", 60, "a");
        fx.clock.advance(Duration.ofSeconds(1));
        blockList.block("2.2.2.2", 60, "b");

        assertEquals(List.of("2.2.2.2", "1.1.1.1"),
                blockList.listBlocked().stream().map(BlockedIP::getIpAddress).toList());
    }

    @Test
    void testIsBlocked_storeFailureFailsOpen() {
        CounterStore failing = mock(CounterStore.class);
        when(failing.getHash(anyString(), anyString())).thenThrow(new StoreUnavailableException("down", null));
        BlockListService service = new BlockListService(failing, fx.windowTracker, fx.objectMapper, fx.clock);

        assertFalse(service.isBlocked("5.6.7.8"));
    }

    @Test
    void testBlock_storeFailurePropagates() {
        CounterStore failing = mock(CounterStore.class);
        when(failing.getHash(anyString(), anyString())).thenReturn(Optional.empty());
        doThrow(new StoreUnavailableException("down", null)).when(failing).putHash(anyString(), anyString(), anyString());
        BlockListService service = new BlockListService(failing, fx.windowTracker, fx.objectMapper, fx.clock);

        assertThrows(StoreUnavailableException.class, () -> service.block("5.6.7.8", 60, "abuse"));
    }
}
