package com.redhat.ci.steps.resources;

import java.util.Map;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;

/**
 * Turns the textual requests and limits of the pipeline configuration into the typed form a build accepts.
 */
public class ResourceRequirementTranslator {

    static final String REQUEST = "request";
    static final String LIMIT = "limit";

    public ResourceRequirements translate(com.redhat.ci.resources.model.ResourceRequirements requirements)
            throws MalformedQuantityException {
        var builder = new ResourceRequirementsBuilder();
        Map<String, Quantity> requests = parse(REQUEST, requirements.requests());
        if (!requests.isEmpty()) {
            builder.withRequests(requests);
        }
        Map<String, Quantity> limits = parse(LIMIT, requirements.limits());
        if (!limits.isEmpty()) {
            builder.withLimits(limits);
        }
        return builder.build();
    }

    public static boolean isValidQuantity(String value) {
        if (value == null) {
            return false;
        }
        try {
            Quantity.parse(value).getNumericalAmount();
            return true;
        } catch (IllegalArgumentException | ArithmeticException e) {
            return false;
        }
    }

    private static Map<String, Quantity> parse(String kind, Map<String, String> values)
            throws MalformedQuantityException {
        //sorted so the same configuration always reports the same offending entry
        Map<String, Quantity> result = new TreeMap<>();
        for (var e : new TreeMap<>(values).entrySet()) {
            Quantity quantity;
            try {
                quantity = Quantity.parse(e.getValue());
                quantity.getNumericalAmount();
            } catch (IllegalArgumentException | ArithmeticException ex) {
                throw new MalformedQuantityException(kind, e.getKey(), e.getValue(), ex);
            }
            result.put(e.getKey(), quantity);
        }
        return result;
    }
}
