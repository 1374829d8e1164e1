package com.redhat.ci.steps;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The parameters a step makes available to the rest of the graph, keyed by parameter name.
 */
public final class ParameterMap implements Iterable<DeferredParameter> {

    private final Map<String, DeferredParameter> parameters;

    private ParameterMap(Map<String, DeferredParameter> parameters) {
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    public static ParameterMap of(DeferredParameter... parameters) {
        Map<String, DeferredParameter> result = new LinkedHashMap<>();
        for (var i : parameters) {
            if (result.put(i.key(), i) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + i.key());
            }
        }
        return new ParameterMap(result);
    }

    public Set<String> keys() {
        return parameters.keySet();
    }

    public Optional<DeferredParameter> get(String key) {
        return Optional.ofNullable(parameters.get(key));
    }

    public String resolve(String key) throws ParameterResolutionException {
        var parameter = parameters.get(key);
        if (parameter == null) {
            throw new ParameterResolutionException("no parameter " + key + " is provided");
        }
        return parameter.resolve();
    }

    @Override
    public Iterator<DeferredParameter> iterator() {
        return parameters.values().iterator();
    }
}
