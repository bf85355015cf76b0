package com.example.admission.service;

import com.example.admission.model.AdmissionResult;
import com.example.admission.model.LimitPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable fixed-window counter for one client.
 * <p>
 * Not thread-safe on its own: every method must be called while holding this object's monitor.
 */
final class ClientState {

    private int count;
    private int denied;
    private Instant windowStart;
    private Instant lastSeen;
    private boolean retired;

    ClientState(Instant now) {
        this.windowStart = now;
        this.lastSeen = now;
    }

    AdmissionResult admit(LimitPolicy policy, Instant now) {
        if (now.isAfter(lastSeen)) {
            lastSeen = now;
        }
        if (windowExpired(policy.getWindow(), now)) {
            windowStart = now;
            count = 0;
            denied = 0;
        }

        int max = policy.getMaxRequests();
        if (count < max) {
            count++;
            return AdmissionResult.allowed(max, max - count);
        }

        denied++;
        Duration elapsed = Duration.between(windowStart, now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        return AdmissionResult.denied(max, policy.getWindow().minus(elapsed));
    }

    /**
     * An entry is idle once its window has closed and nothing touched it for the whole
     * retention period. Entries inside an open window are never idle, whatever their age.
     */
    boolean isIdle(Duration window, Duration retention, Instant now) {
        return windowExpired(window, now) && Duration.between(lastSeen, now).compareTo(retention) >= 0;
    }

    private boolean windowExpired(Duration window, Instant now) {
        return Duration.between(windowStart, now).compareTo(window) >= 0;
    }

    void retire() {
        retired = true;
    }

    boolean isRetired() {
        return retired;
    }

    int getCount() {
        return count;
    }

    int getDenied() {
        return denied;
    }
}
