package com.redhat.ci.steps.build;

import java.io.PrintStream;
import java.util.List;

import org.jboss.logging.Logger;

import com.redhat.ci.resources.model.ModelConstants;

import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.openshift.api.model.Build;

/**
 * Reports what is known about a failed build: its logs, the state of its pod and the events recorded for
 * the pod. Diagnostics are best effort and never fail the caller.
 */
public class BuildDiagnostics {

    private static final Logger log = Logger.getLogger(BuildDiagnostics.class);

    private final BuildClient client;
    private final PrintStream out;

    public BuildDiagnostics(BuildClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public void printBuildLogs(String namespace, String name) {
        try {
            String logs = client.getBuildLog(namespace, name);
            if (logs != null) {
                out.print(logs);
                out.flush();
            }
        } catch (KubernetesClientException e) {
            log.errorf("Unable to retrieve logs from failed build %s: %s", name, e.getMessage());
        }
    }

    public void describeBuildPod(Build build) {
        var annotations = build.getMetadata().getAnnotations();
        String podName = annotations == null ? null : annotations.get(ModelConstants.BUILD_POD_NAME_ANNOTATION);
        if (podName == null || podName.isEmpty()) {
            return;
        }
        String namespace = build.getMetadata().getNamespace();
        try {
            Pod pod = client.getPod(namespace, podName);
            if (pod == null) {
                log.warnf("Build pod %s of build %s no longer exists", podName, build.getMetadata().getName());
                return;
            }
            String unready = reasonsForUnreadyContainers(pod);
            if (!unready.isEmpty()) {
                log.infof("Build pod %s has unready containers:%s", podName, unready);
            }
            log.info(eventsForPod(pod));
        } catch (KubernetesClientException e) {
            log.errorf("Unable to describe build pod %s: %s", podName, e.getMessage());
        }
    }

    static String reasonsForUnreadyContainers(Pod pod) {
        StringBuilder sb = new StringBuilder();
        if (pod.getStatus() == null || pod.getStatus().getContainerStatuses() == null) {
            return "";
        }
        for (ContainerStatus status : pod.getStatus().getContainerStatuses()) {
            if (Boolean.TRUE.equals(status.getReady()) || status.getState() == null) {
                continue;
            }
            var state = status.getState();
            String reason;
            String message;
            if (state.getWaiting() != null) {
                reason = state.getWaiting().getReason();
                message = state.getWaiting().getMessage();
            } else if (state.getTerminated() != null) {
                reason = state.getTerminated().getReason();
                message = state.getTerminated().getMessage();
            } else if (state.getRunning() != null) {
                reason = "Running";
                message = null;
            } else {
                continue;
            }
            sb.append("\n* Container ").append(status.getName()).append(" is not ready with reason ").append(reason);
            if (message != null && !message.isEmpty()) {
                sb.append(" and message ").append(message);
            }
        }
        return sb.toString();
    }

    String eventsForPod(Pod pod) {
        List<Event> events = client.listEvents(pod.getMetadata().getNamespace(), pod.getMetadata().getUid());
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(events.size()).append(" events for Pod ").append(pod.getMetadata().getName())
                .append(':');
        for (var event : events) {
            int count = event.getCount() == null ? 0 : event.getCount();
            String component = event.getSource() == null ? "" : event.getSource().getComponent();
            sb.append("\n* ").append(count).append("x ").append(component).append(": ").append(event.getMessage());
        }
        return sb.toString();
    }
}
