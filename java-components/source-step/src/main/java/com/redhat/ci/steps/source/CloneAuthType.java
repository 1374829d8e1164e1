package com.redhat.ci.steps.source;

public enum CloneAuthType {
    SSH("SSH"),
    OAUTH("OAuth");

    private final String value;

    CloneAuthType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
