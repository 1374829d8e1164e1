package com.redhat.ci.steps.build;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.openshift.api.model.Build;
import io.fabric8.openshift.api.model.BuildBuilder;
import io.fabric8.openshift.api.model.ImageStreamBuilder;
import io.fabric8.openshift.client.OpenShiftClient;
import io.fabric8.openshift.client.server.mock.EnableOpenShiftMockClient;
import io.fabric8.openshift.client.server.mock.OpenShiftMockServer;

@EnableOpenShiftMockClient(crud = true)
public class OpenShiftBuildClientTest {

    static final String NAMESPACE = "ci-op-1234";

    OpenShiftMockServer server;
    OpenShiftClient client;

    static Build build() {
        return new BuildBuilder()
                .withNewMetadata().withNamespace(NAMESPACE).withName("src").endMetadata()
                .withNewSpec().withNewStrategy().withType("Docker").endStrategy().endSpec()
                .build();
    }

    @Test
    public void testCreateAndGet() {
        var buildClient = new OpenShiftBuildClient(client);
        assertNull(buildClient.getBuild(NAMESPACE, "src"));
        buildClient.createBuild(build());
        Build stored = buildClient.getBuild(NAMESPACE, "src");
        assertNotNull(stored);
        assertEquals("Docker", stored.getSpec().getStrategy().getType());
        assertEquals(1, buildClient.objects().size());
    }

    @Test
    public void testCreateTwiceIsAlreadyExists() {
        var buildClient = new OpenShiftBuildClient(client);
        buildClient.createBuild(build());
        KubernetesClientException e = assertThrows(KubernetesClientException.class,
                () -> buildClient.createBuild(build()));
        assertTrue(KubernetesErrors.isAlreadyExists(e));
        assertEquals(1, buildClient.objects().size());
    }

    @Test
    public void testDelete() {
        var buildClient = new OpenShiftBuildClient(client);
        Build created = buildClient.createBuild(build());
        buildClient.deleteBuild(NAMESPACE, "src", created.getMetadata().getUid());
        assertNull(buildClient.getBuild(NAMESPACE, "src"));
    }

    @Test
    public void testDeleteRequestIsForegroundWithUidPrecondition() throws Exception {
        var buildClient = new OpenShiftBuildClient(client);
        Build created = buildClient.createBuild(build());
        String uid = created.getMetadata().getUid();
        assertNotNull(uid);
        buildClient.deleteBuild(NAMESPACE, "src", uid);

        var request = server.getLastRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/apis/build.openshift.io/v1/namespaces/" + NAMESPACE + "/builds/src", request.getPath());
        JsonNode options = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertEquals(0, options.get("gracePeriodSeconds").asLong());
        assertTrue(options.get("gracePeriodSeconds").isNumber());
        assertEquals("Foreground", options.get("propagationPolicy").asText());
        assertEquals(uid, options.get("preconditions").get("uid").asText());
    }

    @Test
    public void testDeleteMissingBuildIsNotFound() {
        var buildClient = new OpenShiftBuildClient(client);
        KubernetesClientException e = assertThrows(KubernetesClientException.class,
                () -> buildClient.deleteBuild(NAMESPACE, "src", "0123"));
        assertTrue(KubernetesErrors.isNotFound(e));
        assertEquals(404, e.getCode());
    }

    @Test
    public void testReadsOfMissingObjects() {
        var buildClient = new OpenShiftBuildClient(client);
        assertNull(buildClient.getImageStream(NAMESPACE, "pipeline"));
        assertNull(buildClient.getPod(NAMESPACE, "src-build"));
    }

    @Test
    public void testReadsOfExistingObjects() {
        var buildClient = new OpenShiftBuildClient(client);
        client.imageStreams().inNamespace(NAMESPACE)
                .resource(new ImageStreamBuilder().withNewMetadata().withName("pipeline").endMetadata().build())
                .create();
        client.pods().inNamespace(NAMESPACE)
                .resource(new PodBuilder().withNewMetadata().withName("src-build").endMetadata().build())
                .create();
        assertEquals("pipeline", buildClient.getImageStream(NAMESPACE, "pipeline").getMetadata().getName());
        assertEquals("src-build", buildClient.getPod(NAMESPACE, "src-build").getMetadata().getName());
    }
}
