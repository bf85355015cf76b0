package com.example.admission.service;

import com.example.admission.exception.InvalidPolicyException;
import com.example.admission.exception.UnconfiguredException;
import com.example.admission.model.AdmissionResult;
import com.example.admission.model.Decision;
import com.example.admission.model.LimitPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionControllerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Instant at(long seconds) {
        return T0.plusSeconds(seconds);
    }

    private static AdmissionController controller(int max, long windowSeconds) {
        AdmissionController controller = new AdmissionController("test");
        controller.configure(LimitPolicy.perSeconds(max, windowSeconds));
        return controller;
    }

    @Test
    void testScenario_twoPerMinute() {
        AdmissionController controller = controller(2, 60);

        assertEquals(Decision.ALLOWED, controller.check("A", at(0)));
        assertEquals(Decision.ALLOWED, controller.check("A", at(1)));
        assertEquals(Decision.DENIED, controller.check("A", at(2)));
        assertEquals(Decision.ALLOWED, controller.check("A", at(61)), "Window should reset after 60s");
    }

    @Test
    void testAtMostMaxPerWindow() {
        AdmissionController controller = controller(5, 10);

        int allowed = 0;
        for (int i = 0; i < 100; i++) {
            Instant now = T0.plusMillis(i * 99L); // 100 calls spread over ~9.8s
            if (controller.check("user1", now) == Decision.ALLOWED) {
                allowed++;
            }
        }

        assertEquals(5, allowed);
    }

    @Test
    void testWindowBoundary_belongsToNewWindow() {
        AdmissionController controller = controller(1, 60);

        assertEquals(Decision.ALLOWED, controller.check("A", at(0)));
        assertEquals(Decision.DENIED, controller.check("A", at(59)));
        assertEquals(Decision.ALLOWED, controller.check("A", at(60)), "Exactly one window later should reset");
        assertEquals(Decision.DENIED, controller.check("A", at(60)));
    }

    @Test
    void testWindowStartsAtFirstRequestAfterReset() {
        AdmissionController controller = controller(1, 60);

        controller.check("A", at(0));
        assertEquals(Decision.ALLOWED, controller.check("A", at(90)));
        // New window opened at t=90, not aligned to t=60
        assertEquals(Decision.DENIED, controller.check("A", at(149)));
        assertEquals(Decision.ALLOWED, controller.check("A", at(150)));
    }

    @Test
    void testGapAfterExhaustion_allowsNextCall() {
        AdmissionController controller = controller(3, 5);
        for (int i = 0; i < 10; i++) {
            controller.check("A", at(0));
        }

        assertEquals(Decision.ALLOWED, controller.check("A", at(5)));
    }

    @Test
    void testDistinctKeys_doNotInterfere() {
        AdmissionController controller = controller(2, 60);

        controller.check("A", at(0));
        controller.check("A", at(0));
        assertEquals(Decision.DENIED, controller.check("A", at(1)));

        assertEquals(Decision.ALLOWED, controller.check("B", at(1)));
        assertEquals(Decision.ALLOWED, controller.check("B", at(2)));
        assertEquals(Decision.DENIED, controller.check("B", at(3)));
        assertEquals(2, controller.trackedClients());
    }

    @Test
    void testEvaluate_reportsRemainingAndRetryAfter() {
        AdmissionController controller = controller(2, 60);

        AdmissionResult first = controller.evaluate("A", at(0));
        assertTrue(first.isAllowed());
        assertEquals(2, first.getLimit());
        assertEquals(1, first.getRemaining());
        assertEquals(Duration.ZERO, first.getRetryAfter());

        AdmissionResult second = controller.evaluate("A", at(10));
        assertEquals(0, second.getRemaining());

        AdmissionResult denied = controller.evaluate("A", at(15));
        assertEquals(Decision.DENIED, denied.getDecision());
        assertEquals(0, denied.getRemaining());
        assertEquals(Duration.ofSeconds(45), denied.getRetryAfter());
    }

    @Test
    void testDeniedRequests_doNotConsumeBudget() {
        AdmissionController controller = controller(1, 60);

        controller.check("A", at(0));
        controller.check("A", at(1));
        controller.check("A", at(2));

        ClientState state = controller.stateOf("A");
        assertEquals(1, state.getCount());
        assertEquals(2, state.getDenied());
    }

    @Test
    void testHugeWindow_deniesWithoutOverflow() {
        AdmissionController controller = controller(1, 100_000_000_000_000_000L);

        assertEquals(Decision.ALLOWED, controller.check("A", at(0)));
        assertEquals(Decision.DENIED, controller.check("A", at(0)));

        AdmissionResult denied = controller.evaluate("A", at(10));
        assertEquals(Decision.DENIED, denied.getDecision());
        assertEquals(Duration.ofSeconds(100_000_000_000_000_000L - 10), denied.getRetryAfter());
    }

    @Test
    void testLargestWindow_checkAndEvictionStillWork() {
        AdmissionController controller = controller(1, Long.MAX_VALUE);

        assertEquals(Decision.ALLOWED, controller.check("A", at(0)));
        assertEquals(Decision.DENIED, controller.check("A", at(1)));
        assertEquals(Duration.ofSeconds(Long.MAX_VALUE), controller.effectiveRetention(controller.currentLimit()));
        assertEquals(0, controller.evictIdle(at(1_000_000)));
    }

    @Test
    void testClockMovingBackwards_retryAfterNeverExceedsWindow() {
        AdmissionController controller = controller(1, 60);
        controller.check("A", at(100));

        AdmissionResult denied = controller.evaluate("A", at(90));
        assertEquals(Decision.DENIED, denied.getDecision());
        assertEquals(Duration.ofSeconds(60), denied.getRetryAfter());
    }

    @Test
    void testUnconfigured_rejectsCheckAndCurrentLimit() {
        AdmissionController controller = new AdmissionController("empty");

        assertFalse(controller.isConfigured());
        assertThrows(UnconfiguredException.class, () -> controller.check("A", at(0)));
        assertThrows(UnconfiguredException.class, controller::currentLimit);
        assertEquals(0, controller.evictIdle(at(0)));
    }

    @Test
    void testConfigure_replacesPolicy() {
        AdmissionController controller = controller(2, 60);

        controller.configure(LimitPolicy.perSeconds(5, 30));

        assertEquals(LimitPolicy.perSeconds(5, 30), controller.currentLimit());
    }

    @Test
    void testConfigure_invalidKeepsPreviousPolicy() {
        AdmissionController controller = controller(2, 60);

        assertThrows(InvalidPolicyException.class, () -> controller.configure(LimitPolicy.perSeconds(0, 60)));
        assertThrows(InvalidPolicyException.class, () -> controller.configure(LimitPolicy.perSeconds(5, 0)));
        assertThrows(InvalidPolicyException.class, () -> controller.configure(LimitPolicy.perSeconds(-3, 60)));
        assertThrows(InvalidPolicyException.class, () -> controller.configure(null));

        assertEquals(LimitPolicy.perSeconds(2, 60), controller.currentLimit());
        assertEquals(Decision.ALLOWED, controller.check("A", at(0)));
        assertEquals(Decision.ALLOWED, controller.check("A", at(0)));
        assertEquals(Decision.DENIED, controller.check("A", at(0)));
    }

    @Test
    void testConfigure_lowerLimitDoesNotRevokeAdmittedRequests() {
        AdmissionController controller = controller(5, 60);
        for (int i = 0; i < 4; i++) {
            assertEquals(Decision.ALLOWED, controller.check("A", at(0)));
        }

        controller.configure(LimitPolicy.perSeconds(2, 60));

        AdmissionResult result = controller.evaluate("A", at(1));
        assertEquals(Decision.DENIED, result.getDecision());
        assertEquals(0, result.getRemaining());
        assertEquals(4, controller.stateOf("A").getCount(), "Admitted requests stay counted");
    }

    @Test
    void testConfigure_higherLimitAppliesToOpenWindow() {
        AdmissionController controller = controller(1, 60);
        controller.check("A", at(0));
        assertEquals(Decision.DENIED, controller.check("A", at(1)));

        controller.configure(LimitPolicy.perSeconds(3, 60));

        assertEquals(Decision.ALLOWED, controller.check("A", at(2)));
        assertEquals(Decision.ALLOWED, controller.check("A", at(3)));
        assertEquals(Decision.DENIED, controller.check("A", at(4)));
    }

    @Test
    void testInvalidArguments() {
        AdmissionController controller = controller(1, 60);

        assertThrows(IllegalArgumentException.class, () -> controller.check(null, at(0)));
        assertThrows(IllegalArgumentException.class, () -> controller.check("A", null));
        assertThrows(IllegalArgumentException.class, () -> new AdmissionController(" "));
        assertThrows(InvalidPolicyException.class, () -> new AdmissionController("g", Duration.ZERO));
    }

    // ========== EVICTION ==========

    @Test
    void testEvictIdle_removesExpiredIdleClients() {
        AdmissionController controller = controller(2, 60);
        controller.check("A", at(0));
        controller.check("B", at(100));

        // Default retention is three windows
        assertEquals(0, controller.evictIdle(at(179)));
        assertEquals(1, controller.evictIdle(at(180)));
        assertNull(controller.stateOf("A"));
        assertNotNull(controller.stateOf("B"));
        assertEquals(1, controller.trackedClients());
    }

    @Test
    void testEvictIdle_keepsActiveWindowWithDenials() {
        AdmissionController controller = new AdmissionController("test", Duration.ofSeconds(60));
        controller.configure(LimitPolicy.perSeconds(1, 60));
        controller.check("A", at(0));
        controller.check("A", at(0));

        assertEquals(0, controller.evictIdle(at(59)));
        assertEquals(1, controller.stateOf("A").getDenied());
    }

    @Test
    void testEvictIdle_evictedClientStartsFresh() {
        AdmissionController controller = controller(1, 10);
        controller.check("A", at(0));

        assertEquals(1, controller.evictIdle(at(30)));
        assertEquals(Decision.ALLOWED, controller.check("A", at(30)));
        assertEquals(Decision.DENIED, controller.check("A", at(31)));
    }

    @Test
    void testConfigure_rejectsWindowLongerThanRetention() {
        AdmissionController controller = new AdmissionController("test", Duration.ofSeconds(30));

        assertThrows(InvalidPolicyException.class, () -> controller.configure(LimitPolicy.perSeconds(1, 60)));
        assertFalse(controller.isConfigured());

        controller.configure(LimitPolicy.perSeconds(1, 30));
        assertEquals(Duration.ofSeconds(30), controller.effectiveRetention(controller.currentLimit()));
    }
}
