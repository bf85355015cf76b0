package com.example.admission.controller;

import com.example.admission.controller.dto.LimitResponse;
import com.example.admission.controller.dto.LimitUpdateRequest;
import com.example.admission.exception.InvalidPolicyException;
import com.example.admission.model.LimitPolicy;
import com.example.admission.service.AdmissionController;
import com.example.admission.service.AdmissionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Reads and replaces limit policies at runtime.
 * <p>
 * A rejected update leaves the group's previous policy in effect.
 */
@RestController
@RequestMapping("/rate_limit")
public class RateLimitAdminController {

    private static final Logger log = LoggerFactory.getLogger(RateLimitAdminController.class);

    private final AdmissionRegistry registry;

    public RateLimitAdminController(AdmissionRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public LimitResponse currentDefault() {
        return current(AdmissionRegistry.DEFAULT_GROUP);
    }

    @GetMapping("/{group}")
    public LimitResponse current(@PathVariable String group) {
        AdmissionController controller = registry.get(group);
        return new LimitResponse(null, group, controller.currentLimit());
    }

    @PostMapping
    public LimitResponse updateDefault(@RequestBody LimitUpdateRequest request) {
        return update(AdmissionRegistry.DEFAULT_GROUP, request);
    }

    @PostMapping("/{group}")
    public LimitResponse update(@PathVariable String group, @RequestBody LimitUpdateRequest request) {
        AdmissionController controller = registry.get(group);
        try {
            LimitPolicy policy = toPolicy(controller, request);
            controller.configure(policy);
            return new LimitResponse("Rate limit successfully updated!", group, policy);
        } catch (InvalidPolicyException ex) {
            log.warn("Rejected limit update for group {}: {}", group, ex.getMessage());
            throw ex;
        }
    }

    private LimitPolicy toPolicy(AdmissionController controller, LimitUpdateRequest request) {
        if (request == null || request.getLimit() == null) {
            throw new InvalidPolicyException("limit is required");
        }
        Duration window;
        if (request.getWindowSeconds() != null) {
            window = Duration.ofSeconds(request.getWindowSeconds());
        } else if (controller.isConfigured()) {
            window = controller.currentLimit().getWindow();
        } else {
            throw new InvalidPolicyException("window_seconds is required for an unconfigured group");
        }
        return new LimitPolicy(request.getLimit(), window);
    }
}
