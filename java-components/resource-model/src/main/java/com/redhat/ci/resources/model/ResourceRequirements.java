package com.redhat.ci.resources.model;

import java.util.Map;

import lombok.Builder;

/**
 * Requests and limits keyed by resource name, with values in Kubernetes quantity notation ({@code 500m},
 * {@code 1Gi}).
 */
@Builder(builderClassName = "Builder")
public record ResourceRequirements(Map<String, String> requests, Map<String, String> limits) {

    public ResourceRequirements {
        requests = requests == null ? Map.of() : Map.copyOf(requests);
        limits = limits == null ? Map.of() : Map.copyOf(limits);
    }
}
