package com.redhat.ci.steps.source;

/**
 * An image stream tag could not be turned into a pull spec.
 */
public class StreamUnresolvableException extends Exception {

    public StreamUnresolvableException(String message) {
        super(message);
    }

    public StreamUnresolvableException(String message, Throwable cause) {
        super(message, cause);
    }
}
