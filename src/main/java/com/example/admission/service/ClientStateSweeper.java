package com.example.admission.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically drops idle client entries so the per-client maps stay bounded.
 */
@Component
public class ClientStateSweeper {

    private static final Logger log = LoggerFactory.getLogger(ClientStateSweeper.class);

    private final AdmissionRegistry registry;
    private final Clock clock;

    public ClientStateSweeper(AdmissionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${admission.sweep-interval-ms:30000}",
            initialDelayString = "${admission.sweep-interval-ms:30000}"
    )
    public int sweep() {
        Instant now = clock.instant();
        int total = 0;
        for (AdmissionController controller : registry.all()) {
            int removed = controller.evictIdle(now);
            if (removed > 0) {
                log.debug("Evicted {} idle clients from group {} ({} still tracked)",
                        removed, controller.getGroup(), controller.trackedClients());
            }
            total += removed;
        }
        return total;
    }
}
