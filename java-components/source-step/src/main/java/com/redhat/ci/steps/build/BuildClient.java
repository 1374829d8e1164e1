package com.redhat.ci.steps.build;

import java.util.List;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.openshift.api.model.Build;
import io.fabric8.openshift.api.model.ImageStream;
import io.fabric8.openshift.api.model.ImageStreamTag;

/**
 * The cluster operations the source step needs. Reads return {@code null} for objects that do not exist;
 * every other failure is reported as a {@link io.fabric8.kubernetes.client.KubernetesClientException}.
 */
public interface BuildClient {

    /**
     * Creates the build, failing with a 409 if a build of that name already exists.
     */
    Build createBuild(Build build);

    Build getBuild(String namespace, String name);

    /**
     * Deletes the build in the foreground with no grace period, only if it still has the given UID.
     */
    void deleteBuild(String namespace, String name, String uid);

    String getBuildLog(String namespace, String name);

    ImageStream getImageStream(String namespace, String name);

    ImageStreamTag getImageStreamTag(String namespace, String name);

    Pod getPod(String namespace, String name);

    List<Event> listEvents(String namespace, String involvedObjectUid);

    /**
     * The objects created through this client.
     */
    List<HasMetadata> objects();
}
