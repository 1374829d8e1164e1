package com.redhat.ci.resources.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Resource requirements per step name. The {@value #DEFAULTS} entry applies to every step and is
 * overridden key by key by the step's own entry.
 */
public class ResourceConfiguration {

    public static final String DEFAULTS = "*";

    private final Map<String, ResourceRequirements> requirements;

    public ResourceConfiguration(Map<String, ResourceRequirements> requirements) {
        this.requirements = requirements == null ? Map.of() : Map.copyOf(requirements);
    }

    public static ResourceConfiguration empty() {
        return new ResourceConfiguration(Map.of());
    }

    public ResourceRequirements requirementsForStep(String name) {
        Map<String, String> requests = new HashMap<>();
        Map<String, String> limits = new HashMap<>();
        var defaults = requirements.get(DEFAULTS);
        if (defaults != null) {
            requests.putAll(defaults.requests());
            limits.putAll(defaults.limits());
        }
        var values = requirements.get(name);
        if (values != null) {
            requests.putAll(values.requests());
            limits.putAll(values.limits());
        }
        return new ResourceRequirements(requests, limits);
    }
}
