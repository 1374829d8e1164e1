package com.redhat.ci.steps.build;

/**
 * The build could not be driven to a result because a cluster operation failed.
 */
public class BuildLifecycleException extends Exception {

    public BuildLifecycleException(String message) {
        super(message);
    }

    public BuildLifecycleException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
