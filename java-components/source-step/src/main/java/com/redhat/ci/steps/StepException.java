package com.redhat.ci.steps;

/**
 * A step failure tagged with a machine readable reason, so failures can be aggregated across jobs.
 */
public class StepException extends Exception {

    private final String reason;

    public StepException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static StepException forReason(String reason, Throwable cause) {
        if (cause instanceof StepException step && reason.equals(step.getReason())) {
            return step;
        }
        return new StepException(reason, cause.getMessage(), cause);
    }

    public String getReason() {
        return reason;
    }
}
