package com.redhat.ci.steps.build;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.jboss.logging.Logger;

import com.redhat.ci.steps.StepContext;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.openshift.api.model.Build;
import io.fabric8.openshift.api.model.BuildStatus;

/**
 * Drives a build to a result. The build is created, or adopted if it already exists. An existing build that
 * failed because of the infrastructure is deleted and created again, once. The build is then polled until
 * it completes or fails.
 */
public class BuildLifecycleController {

    private static final Logger log = Logger.getLogger(BuildLifecycleController.class);

    private final BuildClient client;
    private final LifecycleSettings settings;
    private final InfraFailureClassifier classifier;
    private final BuildDiagnostics diagnostics;
    private final BuildLogArtifacts artifacts;
    private final Clock clock;

    public BuildLifecycleController(BuildClient client, LifecycleSettings settings, PrintStream out) {
        this(client, settings, out, Clock.systemUTC());
    }

    BuildLifecycleController(BuildClient client, LifecycleSettings settings, PrintStream out, Clock clock) {
        this.client = client;
        this.settings = settings;
        this.classifier = settings.classifier();
        this.diagnostics = new BuildDiagnostics(client, out);
        this.artifacts = new BuildLogArtifacts(client, settings.getArtifactDir());
        this.clock = clock;
    }

    /**
     * Runs the build to completion.
     *
     * @throws BuildFailedException if the build ended in a failed phase
     * @throws BuildLifecycleException if a cluster operation failed
     * @throws java.util.concurrent.CancellationException if the context was cancelled
     */
    public void handleBuild(StepContext context, Build build) throws BuildFailedException, BuildLifecycleException {
        String namespace = build.getMetadata().getNamespace();
        String name = build.getMetadata().getName();
        context.checkCancelled();
        try {
            client.createBuild(build);
        } catch (KubernetesClientException e) {
            if (!KubernetesErrors.isAlreadyExists(e)) {
                throw new BuildLifecycleException("could not create build " + name, e);
            }
            recoverExistingBuild(context, build);
        }
        waitForBuild(context, namespace, name);
        try {
            artifacts.gatherSuccessfulBuildLog(namespace, name);
        } catch (IOException | KubernetesClientException e) {
            log.warnf("Failed to gather the log of build %s: %s", name, e.getMessage());
        }
    }

    private void recoverExistingBuild(StepContext context, Build build) throws BuildLifecycleException {
        String namespace = build.getMetadata().getNamespace();
        String name = build.getMetadata().getName();
        context.checkCancelled();
        Build existing;
        try {
            existing = client.getBuild(namespace, name);
        } catch (KubernetesClientException e) {
            throw new BuildLifecycleException("could not get build " + name, e);
        }
        if (existing == null) {
            throw new BuildLifecycleException("could not get build " + name + ": not found");
        }
        BuildStatus status = existing.getStatus() == null ? new BuildStatus() : existing.getStatus();
        BuildPhase phase = BuildPhase.fromValue(status.getPhase());
        if (!phase.isTerminal() || !classifier.isInfraFailure(status.getReason(), status.getLogSnippet())) {
            log.infof("Found existing build %s in phase %s", name, phase.getValue());
            return;
        }
        log.infof("Build %s previously failed from an infrastructure error (%s), retrying...", name,
                status.getReason());
        try {
            client.deleteBuild(namespace, name, existing.getMetadata().getUid());
        } catch (KubernetesClientException e) {
            //someone else got there first
            if (!KubernetesErrors.isNotFound(e) && !KubernetesErrors.isConflict(e)) {
                throw new BuildLifecycleException("could not delete build " + name, e);
            }
        }
        waitForBuildDeletion(context, namespace, name);
        context.checkCancelled();
        try {
            client.createBuild(build);
        } catch (KubernetesClientException e) {
            if (!KubernetesErrors.isAlreadyExists(e)) {
                throw new BuildLifecycleException("could not recreate build " + name, e);
            }
        }
    }

    private void waitForBuildDeletion(StepContext context, String namespace, String name)
            throws BuildLifecycleException {
        ExponentialBackoff backoff = settings.getDeletionBackoff();
        CompletableFuture<Void> deletion = CompletableFuture.runAsync(() -> {
            try {
                backoff.waitFor(context, () -> client.getBuild(namespace, name) == null);
            } catch (TimeoutException e) {
                throw new CompletionException(e);
            }
        });
        try {
            context.await(deletion);
        } catch (ExecutionException e) {
            throw new BuildLifecycleException("could not wait for build " + name + " to be deleted", e.getCause());
        }
    }

    private void waitForBuild(StepContext context, String namespace, String name)
            throws BuildFailedException, BuildLifecycleException {
        context.checkCancelled();
        Build build;
        try {
            build = client.getBuild(namespace, name);
        } catch (KubernetesClientException e) {
            throw new BuildLifecycleException("could not get build " + name, e);
        }
        if (build == null) {
            throw new BuildLifecycleException("could not find build " + name);
        }
        if (checkFinished(build, "already succeeded in")) {
            return;
        }
        while (true) {
            context.sleep(settings.getPollInterval());
            try {
                build = client.getBuild(namespace, name);
            } catch (KubernetesClientException e) {
                log.warnf("Failed to get build %s: %s", name, e.getMessage());
                continue;
            }
            if (build == null) {
                log.warnf("Failed to get build %s: not found", name);
                continue;
            }
            if (checkFinished(build, "succeeded after")) {
                return;
            }
        }
    }

    /**
     * @return true if the build completed
     * @throws BuildFailedException if the build failed
     */
    private boolean checkFinished(Build build, String successVerb) throws BuildFailedException {
        String name = build.getMetadata().getName();
        BuildStatus status = build.getStatus() == null ? new BuildStatus() : build.getStatus();
        BuildPhase phase = BuildPhase.fromValue(status.getPhase());
        if (phase == BuildPhase.COMPLETE) {
            log.infof("Build %s %s %s", name, successVerb, formatDuration(buildDuration(build)));
            return true;
        }
        if (phase.isFailure()) {
            log.infof("Build %s failed, printing logs:", name);
            diagnostics.printBuildLogs(build.getMetadata().getNamespace(), name);
            diagnostics.describeBuildPod(build);
            throw new BuildFailedException(name, phase, formatDuration(buildDuration(build)), status.getReason(),
                    status.getMessage(), status.getLogSnippet());
        }
        return false;
    }

    /**
     * From the start of the build, or its creation if it never started, to its completion, or now if it has
     * not completed.
     */
    Duration buildDuration(Build build) {
        BuildStatus status = build.getStatus();
        Instant start = parse(status == null ? null : status.getStartTimestamp());
        if (start == null) {
            start = parse(build.getMetadata().getCreationTimestamp());
        }
        Instant end = parse(status == null ? null : status.getCompletionTimestamp());
        if (end == null) {
            end = clock.instant();
        }
        if (start == null || end.isBefore(start)) {
            return Duration.ZERO;
        }
        return Duration.between(start, end);
    }

    private static Instant parse(String timestamp) {
        if (timestamp == null || timestamp.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            log.debugf("Ignoring malformed timestamp %s", timestamp);
            return null;
        }
    }

    /**
     * Formats whole seconds the way durations read in job logs, e.g. {@code 1h2m5s}, {@code 1m5s} or
     * {@code 5s}.
     */
    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        StringBuilder sb = new StringBuilder();
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (hours > 0 || minutes > 0) {
            sb.append(minutes).append('m');
        }
        sb.append(secs).append('s');
        return sb.toString();
    }
}
