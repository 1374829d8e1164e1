package com.redhat.ci.steps;

public class ParameterResolutionException extends Exception {

    public ParameterResolutionException(String message) {
        super(message);
    }

    public ParameterResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
