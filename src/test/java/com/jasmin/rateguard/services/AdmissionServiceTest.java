package com.jasmin.rateguard.services;

import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.models.AdmissionResult;
import com.jasmin.rateguard.models.BlockedIP;
import com.jasmin.rateguard.models.ViolationEvent;
import com.jasmin.rateguard.support.RateGuardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static com.jasmin.rateguard.support.RateGuardFixture.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AdmissionServiceTest {

    private RateGuardFixture fx;

    @BeforeEach
    void setUp() {
        fx = new RateGuardFixture();
        fx.ruleStore.createRule(defaultRule());
        fx.ruleStore.createRule(strictRule());
    }

    @Test
    void testStrictPathScenario_eleventhRejectedThenNewWindow() {
        for (int i = 1; i <= 10; i++) {
            AdmissionResult result = fx.admission.admit("1.2.3.4", "tenants", "/api/tenants");
            assertTrue(result.isAllowed(), "request " + i);
            assertEquals("strict", result.getRule().getRouteType());
            assertEquals(10 - i, result.getStatus().getRemainingRequests());
        }

        AdmissionResult eleventh = fx.admission.admit("1.2.3.4", "tenants", "/api/tenants");
        assertFalse(eleventh.isAllowed());
        assertEquals(AdmissionResult.Decision.RATE_LIMITED, eleventh.getDecision());
        assertEquals(0, eleventh.getStatus().getRemainingRequests());

        fx.clock.advance(Duration.ofSeconds(61));

        AdmissionResult twelfth = fx.admission.admit("1.2.3.4", "tenants", "/api/tenants");
        assertTrue(twelfth.isAllowed());
        assertEquals(1, twelfth.getStatus().getCurrentRequests());
    }

    @Test
    void testBlockScenario_blockedUntilExpiryAndSweep() {
        fx.blockList.block("5.6.7.8", 60, "abuse");

        AdmissionResult blocked = fx.admission.admit("5.6.7.8", "default", "/api/orders");
        assertFalse(blocked.isAllowed());
        assertEquals(AdmissionResult.Decision.IP_BLOCKED, blocked.getDecision());
        assertNull(blocked.getRule());
        assertEquals(fx.clock.instant().plus(Duration.ofMinutes(60)), blocked.getBlockedUntil());
        assertFalse(fx.admission.admit("5.6.7.8", "strict", "/api/tenants").isAllowed());
        assertTrue(fx.windowTracker.getStatus("5.6.7.8", "default").isEmpty(), "blocked calls are not counted");

        fx.clock.advance(Duration.ofMinutes(61));
        assertEquals(1, fx.blockList.sweepExpired());

        AdmissionResult after = fx.admission.admit("5.6.7.8", "default", "/api/orders");
        assertTrue(after.isAllowed());
        assertEquals(1, after.getStatus().getCurrentRequests());
    }

    @Test
    void testPermanentBlock_hasNoExpiry() {
        fx.blockList.blockPermanently("5.6.7.8", "abuse");

        AdmissionResult blocked = fx.admission.admit("5.6.7.8", "default", "/api/orders");

        assertEquals(AdmissionResult.Decision.IP_BLOCKED, blocked.getDecision());
        assertNull(blocked.getBlockedUntil());
    }

    @Test
    void testUnnamedRoute_resolvedByPath() {
        assertEquals("strict", fx.admission.admit("1.2.3.4", null, "/api/tenants/9").getRule().getRouteType());
        assertEquals("default", fx.admission.admit("1.2.3.4", null, "/api/orders").getRule().getRouteType());
        assertEquals(AdmissionResult.Decision.NO_RULE, fx.admission.admit("1.2.3.4", null, "/api/items/3").getDecision());
    }

    @Test
    void testNoRule_allowedWithoutStatus() {
        AdmissionResult result = fx.admission.admit("1.2.3.4", "api", "/api/products/1");

        assertTrue(result.isAllowed());
        assertEquals(AdmissionResult.Decision.NO_RULE, result.getDecision());
        assertNull(result.getStatus());
    }

    @Test
    void testLimiterDisabled_allowsEverything() {
        fx.props.setEnabled(false);
        fx.blockList.block("5.6.7.8", 60, "abuse");

        AdmissionResult result = fx.admission.admit("5.6.7.8", "strict", "/api/tenants");

        assertTrue(result.isAllowed());
        assertEquals(AdmissionResult.Decision.LIMITER_DISABLED, result.getDecision());
    }

    @Test
    void testRuleUpdate_appliesToNextRequest() {
        fx.ruleStore.createRule(rule("login", 5, 1));
        fx.admission.admit("1.2.3.4", "login", "/login");
        fx.ruleStore.deleteRule("login");

        AdmissionResult result = fx.admission.admit("1.2.3.4", "login", "/login");

        assertEquals("default", result.getRule().getRouteType());
    }

    @Test
    void testViolation_notifiesSinks() {
        List<ViolationEvent> events = new ArrayList<>();
        fx.sinks.add(events::add);
        fx.sinks.add(e -> {
            throw new IllegalStateException("broken sink");
        });
        fx.ruleStore.createRule(rule("login", 1, 1));

        fx.admission.admit("1.2.3.4", "login", "/login");
        AdmissionResult rejected = fx.admission.admit("1.2.3.4", "login", "/login");

        assertFalse(rejected.isAllowed());
        assertEquals(1, events.size());
        assertEquals("1.2.3.4", events.get(0).getIp());
        assertEquals("login", events.get(0).getRouteType());
        assertEquals(fx.clock.instant(), events.get(0).getTimestamp());
    }

    @Test
    void testAutoBlock_escalatesAfterThreshold() {
        RateLimitProperties props = new RateLimitProperties();
        props.getAutoBlock().setEnabled(true);
        props.getAutoBlock().setViolationThreshold(3);
        props.getAutoBlock().setBlockMinutes(15);
        RateGuardFixture auto = new RateGuardFixture(props);
        auto.ruleStore.createRule(rule("login", 1, 1));

        auto.admission.admit("9.9.9.9", "login", "/login");
        auto.admission.admit("9.9.9.9", "login", "/login");
        auto.admission.admit("9.9.9.9", "login", "/login");
        assertFalse(auto.blockList.isBlocked("9.9.9.9"));

        AdmissionResult fourth = auto.admission.admit("9.9.9.9", "login", "/login");
        assertEquals(AdmissionResult.Decision.RATE_LIMITED, fourth.getDecision());
        assertTrue(auto.blockList.isBlocked("9.9.9.9"));

        BlockedIP block = auto.blockList.getBlock("9.9.9.9").orElseThrow();
        assertEquals("auto", block.getMetadata().get("source"));
        assertEquals("login", block.getMetadata().get("routeType"));
        assertEquals(auto.clock.instant().plus(Duration.ofMinutes(15)), block.getExpiresAt());
        assertEquals(AdmissionResult.Decision.IP_BLOCKED, auto.admission.admit("9.9.9.9", "login", "/login").getDecision());
    }

    @Test
    void testAutoBlock_disabledByDefault() {
        fx.ruleStore.createRule(rule("login", 1, 1));
        for (int i = 0; i < 50; i++) {
            fx.admission.admit("9.9.9.9", "login", "/login");
        }
        assertFalse(fx.blockList.isBlocked("9.9.9.9"));
    }

    @Test
    void testUnexpectedFailure_failsOpen() {
        RuleStore broken = mock(RuleStore.class);
        when(broken.resolveRule(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));
        AdmissionService service = new AdmissionService(broken, fx.windowTracker, fx.blockList, fx.metrics,
                fx.sinks, fx.store, fx.props, fx.clock);

        AdmissionResult result = service.admit("1.2.3.4", "default", "/x");

        assertTrue(result.isAllowed());
        assertEquals(AdmissionResult.Decision.FAIL_OPEN, result.getDecision());
    }

    @Test
    void testMissingAddress_trackedAsUnknown() {
        fx.ruleStore.createRule(rule("login", 1, 1));

        assertTrue(fx.admission.admit(null, "login", "/login").isAllowed());
        assertFalse(fx.admission.admit("", "login", "/login").isAllowed());
    }

    @Test
    void testConcurrentRequests_exactlyMaxAllowed() throws InterruptedException {
        fx.ruleStore.createRule(rule("burst", 50, 1));
        int threads = 20;
        int perThread = 10;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger allowed = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int j = 0; j < perThread; j++) {
                        if (fx.admission.admit("7.7.7.7", "burst", "/burst").isAllowed()) {
                            allowed.incrementAndGet();
                        } else {
                            rejected.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(50, allowed.get());
        assertEquals(threads * perThread - 50, rejected.get());
    }
}
