package com.redhat.ci.steps;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A parameter whose value is computed when it is read rather than when the graph is built, for values such
 * as image digests that only exist once the step providing them has run. Every call to {@link #resolve()}
 * evaluates the value again.
 */
public final class DeferredParameter {

    private final String key;
    private final Callable<String> resolver;

    public DeferredParameter(String key, Callable<String> resolver) {
        this.key = Objects.requireNonNull(key);
        this.resolver = Objects.requireNonNull(resolver);
    }

    public String key() {
        return key;
    }

    public String resolve() throws ParameterResolutionException {
        try {
            return resolver.call();
        } catch (ParameterResolutionException e) {
            throw e;
        } catch (Exception e) {
            throw new ParameterResolutionException("could not resolve parameter " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "DeferredParameter{" + key + "}";
    }
}
