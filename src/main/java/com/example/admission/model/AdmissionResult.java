package com.example.admission.model;

import java.time.Duration;

/**
 * Result returned by the admission controller for a single request.
 */
public class AdmissionResult {

    private final Decision decision;
    private final int limit;
    private final int remaining;
    private final Duration retryAfter;

    public AdmissionResult(Decision decision, int limit, int remaining, Duration retryAfter) {
        this.decision = decision;
        this.limit = limit;
        this.remaining = Math.max(0, remaining);
        this.retryAfter = retryAfter;
    }

    public static AdmissionResult allowed(int limit, int remaining) {
        return new AdmissionResult(Decision.ALLOWED, limit, remaining, Duration.ZERO);
    }

    public static AdmissionResult denied(int limit, Duration retryAfter) {
        return new AdmissionResult(Decision.DENIED, limit, 0, retryAfter);
    }

    public Decision getDecision() {
        return decision;
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOWED;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * @return admissions left in the client's current window, never negative
     */
    public int getRemaining() {
        return remaining;
    }

    /**
     * @return time until the client's current window closes; zero for allowed requests
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
