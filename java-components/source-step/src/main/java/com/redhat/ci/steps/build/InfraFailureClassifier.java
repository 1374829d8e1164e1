package com.redhat.ci.steps.build;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a failed build failed because of the cluster rather than because of the code being
 * built. Infrastructure failures are worth retrying, other failures are not.
 */
public class InfraFailureClassifier {

    public static final Set<String> DEFAULT_REASONS = Set.of(
            "CannotCreateBuildPod",
            "BuildPodDeleted",
            "ExceededRetryTimeout",
            "PushImageToRegistryFailed",
            "PullBuilderImageFailed",
            "FetchSourceFailed",
            "BuildPodExists",
            "NoBuildContainerStatus",
            "FailedContainer",
            "OutOfMemoryKilled",
            "CannotRetrieveServiceAccount",
            "FetchImageContentFailed",
            "BuildPodEvicted");

    public static final List<String> DEFAULT_LOG_HINTS = List.of(
            "error: build error: no such image",
            "[Errno 256] No more mirrors to try.",
            "Error: Failed to synchronize cache for repo",
            "Could not resolve host: ",
            "net/http: TLS handshake timeout",
            "All mirrors were tried",
            "connection reset by peer");

    private final Set<String> reasons;
    private final List<String> logHints;

    public InfraFailureClassifier() {
        this(DEFAULT_REASONS, DEFAULT_LOG_HINTS);
    }

    public InfraFailureClassifier(Set<String> reasons, List<String> logHints) {
        this.reasons = Set.copyOf(reasons);
        this.logHints = List.copyOf(logHints);
    }

    public boolean isInfraReason(String reason) {
        return reason != null && reasons.contains(reason);
    }

    public boolean hintsAtInfraReason(String logSnippet) {
        if (logSnippet == null || logSnippet.isEmpty()) {
            return false;
        }
        for (var hint : logHints) {
            if (logSnippet.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    public boolean isInfraFailure(String reason, String logSnippet) {
        return isInfraReason(reason) || hintsAtInfraReason(logSnippet);
    }
}
