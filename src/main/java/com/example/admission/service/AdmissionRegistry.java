package com.example.admission.service;

import com.example.admission.exception.UnknownLimitGroupException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns one {@link AdmissionController} per limit group.
 * <p>
 * The {@value #DEFAULT_GROUP} group always exists, configured or not. A group may stack the
 * limits of other groups on top of its own (its tiers); {@link #chainOrDefault(String)} returns
 * the group's own controller followed by its tiers.
 */
public class AdmissionRegistry {

    public static final String DEFAULT_GROUP = "default";
    public static final String RESOURCE_GROUP = "resource";

    private final Map<String, AdmissionController> controllers;
    private final Map<String, List<AdmissionController>> chains;

    public AdmissionRegistry(Map<String, AdmissionController> controllers) {
        this(controllers, Map.of());
    }

    /**
     * @param tiers group name to the names of further groups whose limits also apply
     * @throws UnknownLimitGroupException if a tier or a tiered group is not registered
     */
    public AdmissionRegistry(Map<String, AdmissionController> controllers, Map<String, List<String>> tiers) {
        Map<String, AdmissionController> copy = new LinkedHashMap<>(controllers);
        copy.computeIfAbsent(DEFAULT_GROUP, AdmissionController::new);
        this.controllers = Collections.unmodifiableMap(copy);

        Map<String, List<AdmissionController>> built = new LinkedHashMap<>();
        for (Map.Entry<String, AdmissionController> entry : copy.entrySet()) {
            built.put(entry.getKey(), List.of(entry.getValue()));
        }
        for (Map.Entry<String, List<String>> entry : tiers.entrySet()) {
            String group = entry.getKey();
            List<AdmissionController> chain = new ArrayList<>();
            chain.add(get(group));
            for (String tier : entry.getValue()) {
                AdmissionController tierController = get(tier);
                if (tier.equals(group)) {
                    throw new IllegalArgumentException("group '" + group + "' cannot list itself as a tier");
                }
                if (!chain.contains(tierController)) {
                    chain.add(tierController);
                }
            }
            built.put(group, List.copyOf(chain));
        }
        this.chains = Collections.unmodifiableMap(built);
    }

    /**
     * @throws UnknownLimitGroupException if no controller is registered under {@code group}
     */
    public AdmissionController get(String group) {
        AdmissionController controller = controllers.get(group);
        if (controller == null) {
            throw new UnknownLimitGroupException(group);
        }
        return controller;
    }

    /**
     * Controllers that must all admit a request routed to {@code group}, the group's own first.
     * Falls back to the default group's chain for unknown names.
     */
    public List<AdmissionController> chainOrDefault(String group) {
        List<AdmissionController> chain = chains.get(group);
        return chain != null ? chain : chains.get(DEFAULT_GROUP);
    }

    public AdmissionController defaultController() {
        return controllers.get(DEFAULT_GROUP);
    }

    public Collection<AdmissionController> all() {
        return controllers.values();
    }
}
