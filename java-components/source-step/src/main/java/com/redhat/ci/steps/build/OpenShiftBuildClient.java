package com.redhat.ci.steps.build;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jboss.logging.Logger;

import io.fabric8.kubernetes.api.model.DeleteOptions;
import io.fabric8.kubernetes.api.model.DeleteOptionsBuilder;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PreconditionsBuilder;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.utils.URLUtils;
import io.fabric8.openshift.api.model.Build;
import io.fabric8.openshift.api.model.ImageStream;
import io.fabric8.openshift.api.model.ImageStreamTag;
import io.fabric8.openshift.client.OpenShiftClient;

public class OpenShiftBuildClient implements BuildClient {

    private static final Logger log = Logger.getLogger(OpenShiftBuildClient.class);

    static final String FOREGROUND = "Foreground";

    private final OpenShiftClient client;
    private final List<HasMetadata> created = new CopyOnWriteArrayList<>();

    public OpenShiftBuildClient(OpenShiftClient client) {
        this.client = client;
    }

    @Override
    public Build createBuild(Build build) {
        Build result = client.builds().inNamespace(build.getMetadata().getNamespace()).resource(build).create();
        created.add(result);
        return result;
    }

    @Override
    public Build getBuild(String namespace, String name) {
        return client.builds().inNamespace(namespace).withName(name).get();
    }

    @Override
    public void deleteBuild(String namespace, String name, String uid) {
        DeleteOptions options = new DeleteOptionsBuilder()
                .withGracePeriodSeconds(0L)
                .withPropagationPolicy(FOREGROUND)
                .withPreconditions(new PreconditionsBuilder().withUid(uid).build())
                .build();
        String url = URLUtils.join(client.getMasterUrl().toString(), "apis", "build.openshift.io", "v1",
                "namespaces", namespace, "builds", name);
        log.debugf("Deleting build %s/%s with uid %s", namespace, name, uid);
        //the raw call reports a missing object as a null body
        if (client.raw(url, "DELETE", options) == null) {
            throw new KubernetesClientException(new StatusBuilder()
                    .withCode(404)
                    .withReason("NotFound")
                    .withMessage("builds.build.openshift.io \"" + name + "\" not found")
                    .build());
        }
    }

    @Override
    public String getBuildLog(String namespace, String name) {
        return client.builds().inNamespace(namespace).withName(name).getLog();
    }

    @Override
    public ImageStream getImageStream(String namespace, String name) {
        return client.imageStreams().inNamespace(namespace).withName(name).get();
    }

    @Override
    public ImageStreamTag getImageStreamTag(String namespace, String name) {
        return client.imageStreamTags().inNamespace(namespace).withName(name).get();
    }

    @Override
    public Pod getPod(String namespace, String name) {
        return client.pods().inNamespace(namespace).withName(name).get();
    }

    @Override
    public List<Event> listEvents(String namespace, String involvedObjectUid) {
        return client.v1().events().inNamespace(namespace).withField("involvedObject.uid", involvedObjectUid).list()
                .getItems();
    }

    @Override
    public List<HasMetadata> objects() {
        return List.copyOf(created);
    }
}
