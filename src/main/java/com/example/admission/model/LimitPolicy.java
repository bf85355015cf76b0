package com.example.admission.model;

import com.example.admission.exception.InvalidPolicyException;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable fixed-window limit: at most {@code maxRequests} admissions per client in each
 * {@code window}.
 */
public final class LimitPolicy {

    private final int maxRequests;
    private final Duration window;

    /**
     * @throws InvalidPolicyException if {@code maxRequests <= 0} or the window is missing,
     *                                zero or negative
     */
    public LimitPolicy(int maxRequests, Duration window) {
        if (maxRequests <= 0) {
            throw new InvalidPolicyException("maxRequests must be > 0, got: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new InvalidPolicyException("window must be > 0, got: " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
    }

    public static LimitPolicy perSeconds(int maxRequests, long windowSeconds) {
        return new LimitPolicy(maxRequests, Duration.ofSeconds(windowSeconds));
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LimitPolicy other)) {
            return false;
        }
        return maxRequests == other.maxRequests && window.equals(other.window);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRequests, window);
    }

    @Override
    public String toString() {
        return maxRequests + " per " + window;
    }
}
