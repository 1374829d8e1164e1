package com.redhat.ci.steps.build;

import java.util.Arrays;

/**
 * The lifecycle phase of a build as reported in its status.
 */
public enum BuildPhase {
    NEW("New"),
    PENDING("Pending"),
    RUNNING("Running"),
    COMPLETE("Complete"),
    FAILED("Failed"),
    ERROR("Error"),
    CANCELLED("Cancelled"),
    UNKNOWN("");

    private final String value;

    BuildPhase(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Anything the cluster may report that is not a known phase maps to {@link #UNKNOWN}.
     */
    public static BuildPhase fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values()).filter(p -> p.value.equals(value)).findFirst().orElse(UNKNOWN);
    }

    /**
     * Whether the build will not make any more progress. Unknown phases count as terminal.
     */
    public boolean isTerminal() {
        return this != NEW && this != PENDING && this != RUNNING;
    }

    public boolean isFailure() {
        return this == FAILED || this == ERROR || this == CANCELLED;
    }

    /**
     * How the phase reads in a sentence about the build, e.g. "the build src failed".
     */
    String verb() {
        switch (this) {
            case ERROR:
                return "errored";
            case CANCELLED:
                return "was cancelled";
            default:
                return "failed";
        }
    }
}
