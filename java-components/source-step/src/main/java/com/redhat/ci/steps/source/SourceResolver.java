package com.redhat.ci.steps.source;

import org.jboss.logging.Logger;

import com.redhat.ci.resources.model.ImageStreamTagReference;
import com.redhat.ci.resources.util.RegistryUtil;
import com.redhat.ci.steps.build.BuildClient;

import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.openshift.api.model.ImageStream;
import io.fabric8.openshift.api.model.ImageStreamTag;

/**
 * Resolves image stream tags to pull specs pinned by digest, so a build is not affected by the tag moving
 * while it runs.
 */
public class SourceResolver {

    private static final Logger log = Logger.getLogger(SourceResolver.class);

    static final String DOCKER_IMAGE = "DockerImage";

    private final BuildClient client;

    public SourceResolver(BuildClient client) {
        this.client = client;
    }

    /**
     * Resolves the tag to a {@code DockerImage} reference of the form {@code repository@digest}, using the
     * public repository of the stream when it has one.
     */
    public ObjectReference resolve(ImageStreamTagReference reference) throws StreamUnresolvableException {
        ImageStream stream;
        try {
            stream = client.getImageStream(reference.namespace(), reference.name());
        } catch (KubernetesClientException e) {
            throw new StreamUnresolvableException("could not resolve remote image stream: " + e.getMessage(), e);
        }
        if (stream == null) {
            throw new StreamUnresolvableException(String.format(
                    "could not resolve remote image stream: imagestreams %s/%s not found", reference.namespace(),
                    reference.name()));
        }
        String repository = null;
        if (stream.getStatus() != null) {
            repository = stream.getStatus().getPublicDockerImageRepository();
            if (repository == null || repository.isEmpty()) {
                repository = stream.getStatus().getDockerImageRepository();
            }
        }
        if (repository == null || repository.isEmpty()) {
            throw new StreamUnresolvableException(String.format(
                    "image stream %s/%s has no accessible image registry value", reference.namespace(),
                    reference.name()));
        }
        String digest;
        try {
            digest = imageDigest(reference.namespace(), RegistryUtil.imageStreamTagName(reference.name(),
                    reference.tag()));
        } catch (KubernetesClientException e) {
            throw new StreamUnresolvableException("could not resolve remote image stream tag: " + e.getMessage(), e);
        }
        if (digest == null) {
            throw new StreamUnresolvableException(String.format(
                    "could not resolve remote image stream tag: imagestreamtags %s not found",
                    reference.displayName()));
        }
        String pullSpec = RegistryUtil.digestPullSpec(repository, digest);
        log.debugf("Resolved %s to %s", reference.displayName(), pullSpec);
        return new ObjectReferenceBuilder().withKind(DOCKER_IMAGE).withName(pullSpec).build();
    }

    /**
     * The digest of the image a tag points at, or {@code null} if the tag does not exist.
     */
    public String imageDigest(String namespace, String imageStreamTagName) {
        ImageStreamTag tag = client.getImageStreamTag(namespace, imageStreamTagName);
        if (tag == null || tag.getImage() == null || tag.getImage().getMetadata() == null) {
            return null;
        }
        return tag.getImage().getMetadata().getName();
    }
}
