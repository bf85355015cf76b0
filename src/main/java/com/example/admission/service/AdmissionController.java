package com.example.admission.service;

import com.example.admission.exception.InvalidPolicyException;
import com.example.admission.exception.UnconfiguredException;
import com.example.admission.model.AdmissionResult;
import com.example.admission.model.Decision;
import com.example.admission.model.LimitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed-window admission control keyed by client identity.
 *
 * Each client gets its own {@link ClientState}, created on first use and guarded by its own
 * monitor, so checks for different clients never contend. The active {@link LimitPolicy} is
 * swapped atomically; a check reads it once and finishes under that policy even if it is
 * replaced mid-flight.
 *
 * Entries are removed by {@link #evictIdle(Instant)}. A caller that fetched an entry just
 * before it was evicted sees it retired and starts over on a fresh one.
 */
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    static final int DEFAULT_RETENTION_WINDOWS = 3;

    private static final Duration MAX_RETENTION = Duration.ofSeconds(Long.MAX_VALUE);

    private final String group;
    private final Duration retention;
    private final AtomicReference<LimitPolicy> policy = new AtomicReference<>();
    private final ConcurrentMap<String, ClientState> clients = new ConcurrentHashMap<>();

    /**
     * @param group     name used in logs and errors
     * @param retention how long an idle client is kept after its window closes; {@code null}
     *                  means {@value #DEFAULT_RETENTION_WINDOWS} windows of the active policy
     */
    public AdmissionController(String group, Duration retention) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group cannot be blank");
        }
        if (retention != null && (retention.isZero() || retention.isNegative())) {
            throw new InvalidPolicyException("retention must be > 0, got: " + retention);
        }
        this.group = group;
        this.retention = retention;
    }

    public AdmissionController(String group) {
        this(group, null);
    }

    /**
     * Replaces the active policy. Decisions already in progress keep the policy they started with.
     *
     * @throws InvalidPolicyException if {@code newPolicy} is null or its window is longer than the
     *                                configured retention; the previous policy stays active
     */
    public void configure(LimitPolicy newPolicy) {
        if (newPolicy == null) {
            throw new InvalidPolicyException("policy cannot be null");
        }
        if (retention != null && retention.compareTo(newPolicy.getWindow()) < 0) {
            throw new InvalidPolicyException(
                    "window " + newPolicy.getWindow() + " exceeds retention " + retention + " for group '" + group + "'");
        }
        LimitPolicy previous = policy.getAndSet(newPolicy);
        log.info("Admission policy for group {} changed from {} to {}", group, previous, newPolicy);
    }

    /**
     * Decides whether the client may make one more request at {@code now}.
     *
     * @throws UnconfiguredException if no policy has been configured yet
     */
    public Decision check(String clientKey, Instant now) {
        return evaluate(clientKey, now).getDecision();
    }

    /**
     * Same decision as {@link #check(String, Instant)}, with the remaining budget and the time
     * until the client's window closes.
     *
     * @throws UnconfiguredException if no policy has been configured yet
     */
    public AdmissionResult evaluate(String clientKey, Instant now) {
        if (clientKey == null) {
            throw new IllegalArgumentException("clientKey cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        LimitPolicy active = policy.get();
        if (active == null) {
            throw new UnconfiguredException(group);
        }

        while (true) {
            ClientState state = clients.computeIfAbsent(clientKey, k -> new ClientState(now));
            synchronized (state) {
                if (state.isRetired()) {
                    continue;
                }
                return state.admit(active, now);
            }
        }
    }

    /**
     * @throws UnconfiguredException if no policy has been configured yet
     */
    public LimitPolicy currentLimit() {
        LimitPolicy active = policy.get();
        if (active == null) {
            throw new UnconfiguredException(group);
        }
        return active;
    }

    public boolean isConfigured() {
        return policy.get() != null;
    }

    /**
     * Removes clients whose window has closed and that have been idle for the retention period.
     *
     * @return number of entries removed
     */
    public int evictIdle(Instant now) {
        LimitPolicy active = policy.get();
        if (active == null) {
            return 0;
        }
        Duration keepFor = effectiveRetention(active);

        int removed = 0;
        for (Map.Entry<String, ClientState> entry : clients.entrySet()) {
            ClientState state = entry.getValue();
            synchronized (state) {
                if (state.isIdle(active.getWindow(), keepFor, now) && clients.remove(entry.getKey(), state)) {
                    state.retire();
                    removed++;
                }
            }
        }
        return removed;
    }

    Duration effectiveRetention(LimitPolicy active) {
        if (retention != null) {
            return retention;
        }
        Duration window = active.getWindow();
        if (window.compareTo(MAX_RETENTION.dividedBy(DEFAULT_RETENTION_WINDOWS)) > 0) {
            return MAX_RETENTION;
        }
        return window.multipliedBy(DEFAULT_RETENTION_WINDOWS);
    }

    public int trackedClients() {
        return clients.size();
    }

    public String getGroup() {
        return group;
    }

    ClientState stateOf(String clientKey) {
        return clients.get(clientKey);
    }
}
