package com.example.admission.model;

import com.example.admission.exception.InvalidPolicyException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LimitPolicyTest {

    @Test
    void testValidPolicy() {
        LimitPolicy policy = LimitPolicy.perSeconds(10, 60);

        assertEquals(10, policy.getMaxRequests());
        assertEquals(Duration.ofMinutes(1), policy.getWindow());
        assertEquals(new LimitPolicy(10, Duration.ofSeconds(60)), policy);
    }

    @Test
    void testInvalidArguments() {
        assertThrows(InvalidPolicyException.class, () -> LimitPolicy.perSeconds(0, 60));
        assertThrows(InvalidPolicyException.class, () -> LimitPolicy.perSeconds(-1, 60));
        assertThrows(InvalidPolicyException.class, () -> LimitPolicy.perSeconds(10, 0));
        assertThrows(InvalidPolicyException.class, () -> LimitPolicy.perSeconds(10, -5));
        assertThrows(InvalidPolicyException.class, () -> new LimitPolicy(10, null));
    }

    @Test
    void testSubSecondWindowIsAllowed() {
        LimitPolicy policy = new LimitPolicy(3, Duration.ofMillis(250));

        assertEquals(Duration.ofMillis(250), policy.getWindow());
    }
}
