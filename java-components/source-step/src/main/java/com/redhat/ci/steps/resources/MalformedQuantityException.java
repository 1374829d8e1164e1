package com.redhat.ci.steps.resources;

/**
 * A resource request or limit that is not valid Kubernetes quantity notation.
 */
public class MalformedQuantityException extends Exception {

    private final String resource;
    private final String value;

    public MalformedQuantityException(String kind, String resource, String value) {
        this(kind, resource, value, null);
    }

    public MalformedQuantityException(String kind, String resource, String value, Throwable cause) {
        super(String.format("invalid resource %s for %s: %s is not a valid quantity", kind, resource, value), cause);
        this.resource = resource;
        this.value = value;
    }

    public String getResource() {
        return resource;
    }

    public String getValue() {
        return value;
    }
}
