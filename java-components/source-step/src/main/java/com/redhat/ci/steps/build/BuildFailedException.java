package com.redhat.ci.steps.build;

/**
 * The build ran and ended in a failed phase.
 */
public class BuildFailedException extends Exception {

    private final String buildName;
    private final BuildPhase phase;
    private final String reason;
    private final String logSnippet;

    public BuildFailedException(String buildName, BuildPhase phase, String duration, String reason, String message,
            String logSnippet) {
        super(describe(buildName, phase, duration, reason, message, logSnippet));
        this.buildName = buildName;
        this.phase = phase;
        this.reason = reason;
        this.logSnippet = logSnippet;
    }

    static String describe(String buildName, BuildPhase phase, String duration, String reason, String message,
            String logSnippet) {
        StringBuilder sb = new StringBuilder();
        sb.append("the build ").append(buildName).append(' ').append(phase.verb())
                .append(" after ").append(duration)
                .append(" with reason ").append(reason == null ? "" : reason)
                .append(": ").append(message == null ? "" : message);
        String snippet = logSnippet == null ? "" : logSnippet.trim();
        if (!snippet.isEmpty()) {
            sb.append("\n\n").append(snippet);
        }
        return sb.toString();
    }

    public String getBuildName() {
        return buildName;
    }

    public BuildPhase getPhase() {
        return phase;
    }

    public String getReason() {
        return reason;
    }

    public String getLogSnippet() {
        return logSnippet;
    }
}
