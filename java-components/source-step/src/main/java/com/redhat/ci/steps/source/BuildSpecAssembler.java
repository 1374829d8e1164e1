package com.redhat.ci.steps.source;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jboss.logging.Logger;

import com.redhat.ci.resources.model.JobSpec;
import com.redhat.ci.resources.model.ModelConstants;
import com.redhat.ci.resources.model.Refs;
import com.redhat.ci.resources.model.ResourceConfiguration;
import com.redhat.ci.resources.model.SourceStepConfiguration;
import com.redhat.ci.resources.util.RegistryUtil;
import com.redhat.ci.resources.util.ResourceNameUtils;
import com.redhat.ci.steps.resources.MalformedQuantityException;
import com.redhat.ci.steps.resources.ResourceRequirementTranslator;

import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.LocalObjectReference;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.openshift.api.model.Build;
import io.fabric8.openshift.api.model.BuildBuilder;
import io.fabric8.openshift.api.model.BuildSource;
import io.fabric8.openshift.api.model.BuildSourceBuilder;
import io.fabric8.openshift.api.model.ImageLabel;
import io.fabric8.openshift.api.model.ImageLabelBuilder;
import io.fabric8.openshift.api.model.ImageSourceBuilder;
import io.fabric8.openshift.api.model.ImageSourcePath;
import io.fabric8.openshift.api.model.ImageSourcePathBuilder;
import io.fabric8.openshift.api.model.SecretBuildSourceBuilder;

/**
 * Builds the request for the build that clones the job's refs into a new pipeline image. The result depends
 * only on the arguments, so assembling the same inputs twice gives equal builds.
 */
public class BuildSpecAssembler {

    private static final Logger log = Logger.getLogger(BuildSpecAssembler.class);

    static final String GOPATH = "/go";
    static final String SSH_CONFIG = "/ssh_config";
    static final String SSH_PRIVATE_KEY = "/sshprivatekey";
    static final String OAUTH_TOKEN = "/oauth-token";
    static final String CLONEREFS_LOG = "/dev/null";
    static final String BUILD_LOGLEVEL = "BUILD_LOGLEVEL";
    static final String IMAGE_STREAM_TAG = "ImageStreamTag";

    static final List<String> IMAGE_LABEL_KEYS = List.of(
            "vcs-type",
            "vcs-ref",
            "vcs-url",
            "io.openshift.build.name",
            "io.openshift.build.namespace",
            "io.openshift.build.commit.id",
            "io.openshift.build.commit.ref",
            "io.openshift.build.commit.message",
            "io.openshift.build.commit.author",
            "io.openshift.build.commit.date",
            "io.openshift.build.source-location",
            "io.openshift.build.source-context-dir");

    private final ResourceRequirementTranslator translator;

    public BuildSpecAssembler() {
        this(new ResourceRequirementTranslator());
    }

    public BuildSpecAssembler(ResourceRequirementTranslator translator) {
        this.translator = translator;
    }

    /**
     * @param clonerefsRef the resolved image holding the clonerefs binary
     * @param cloneAuth credentials for private repositories, or {@code null} to clone anonymously
     * @param pullSecret the registry pull secret, or {@code null} if there is none
     */
    public Build createBuild(SourceStepConfiguration config, JobSpec jobSpec, ObjectReference clonerefsRef,
            ResourceConfiguration resources, CloneAuthConfig cloneAuth, Secret pullSecret)
            throws MalformedQuantityException {
        List<Refs> refs = new ArrayList<>();
        if (jobSpec.getRefs() != null) {
            refs.add(withCloneUri(jobSpec.getRefs(), cloneAuth));
        }
        for (var i : jobSpec.getExtraRefs()) {
            refs.add(withCloneUri(i, cloneAuth));
        }

        List<ImageSourcePath> paths = new ArrayList<>();
        paths.add(new ImageSourcePathBuilder().withSourcePath(config.clonerefsPath()).withDestinationDir(".").build());
        var options = CloneRefsOptions.builder()
                .srcRoot(GOPATH)
                .log(CLONEREFS_LOG)
                .gitUserName(CloneRefsOptions.DEFAULT_GIT_USER_NAME)
                .gitUserEmail(CloneRefsOptions.DEFAULT_GIT_USER_EMAIL)
                .refs(refs)
                .fail(true);
        var source = new BuildSourceBuilder()
                .withType("Dockerfile")
                .withDockerfile(sourceDockerfile(config.from(), determineWorkDir(GOPATH, refs), cloneAuth));
        if (cloneAuth != null) {
            log.infof("Cloning with %s credentials from secret %s", cloneAuth.type().getValue(),
                    cloneAuth.secretName());
            source.addToSecrets(new SecretBuildSourceBuilder()
                    .withSecret(new LocalObjectReference(cloneAuth.secretName()))
                    .build());
            if (cloneAuth.type() == CloneAuthType.SSH) {
                paths.add(new ImageSourcePathBuilder().withSourcePath(SSH_CONFIG).withDestinationDir(".").build());
                options.keyFiles(List.of(SSH_PRIVATE_KEY));
            } else {
                options.oauthTokenFile(OAUTH_TOKEN);
            }
        }
        source.withImages(new ImageSourceBuilder().withFrom(clonerefsRef).withPaths(paths).build());

        Build build = buildFromSource(jobSpec, config.from(), config.to(), source.build(), resources, pullSecret);
        build.getSpec().getStrategy().getDockerStrategy().getEnv().add(new EnvVarBuilder()
                .withName(CloneRefsOptions.JSON_CONFIG_ENV_VAR)
                .withValue(options.build().encode())
                .build());
        return build;
    }

    private static Refs withCloneUri(Refs refs, CloneAuthConfig cloneAuth) {
        if (cloneAuth == null) {
            return refs;
        }
        return refs.toBuilder().cloneUri(cloneAuth.cloneUri(refs.org(), refs.repo())).build();
    }

    Build buildFromSource(JobSpec jobSpec, String fromTag, String toTag, BuildSource source,
            ResourceConfiguration resources, Secret pullSecret) throws MalformedQuantityException {
        log.infof("Building %s", toTag);
        ResourceRequirements buildResources = translator.translate(resources.requirementsForStep(toTag));
        String namespace = jobSpec.getNamespace();
        ObjectReference from = null;
        if (fromTag != null && !fromTag.isEmpty()) {
            from = pipelineTagReference(namespace, fromTag);
        }
        Map<String, String> labels = new TreeMap<>(defaultPodLabels(jobSpec));
        labels.put(ModelConstants.CREATES_LABEL, ResourceNameUtils.trimLabelValue(toTag));
        Map<String, String> annotations = new HashMap<>();
        annotations.put(ModelConstants.JOB_SPEC_ANNOTATION, jobSpec.getRawSpec());

        List<EnvVar> env = new ArrayList<>();
        env.add(new EnvVarBuilder().withName(BUILD_LOGLEVEL).withValue("0").build());

        Build build = new BuildBuilder()
                .withNewMetadata()
                .withName(toTag)
                .withNamespace(namespace)
                .withLabels(labels)
                .withAnnotations(annotations)
                .endMetadata()
                .withNewSpec()
                .withResources(buildResources)
                .withSource(source)
                .withNewStrategy()
                .withType("Docker")
                .withNewDockerStrategy()
                .withFrom(from)
                .withForcePull(true)
                .withNoCache(true)
                .withEnv(env)
                .withImageOptimizationPolicy("SkipLayers")
                .endDockerStrategy()
                .endStrategy()
                .withNewOutput()
                .withTo(pipelineTagReference(namespace, toTag))
                .withImageLabels(imageLabels(jobSpec.getRefs(), source.getContextDir()))
                .endOutput()
                .endSpec()
                .build();
        if (pullSecret != null) {
            build.getSpec().getStrategy().getDockerStrategy()
                    .setPullSecret(new LocalObjectReference(ModelConstants.PULL_SECRET_NAME));
        }
        if (jobSpec.getOwner() != null) {
            List<io.fabric8.kubernetes.api.model.OwnerReference> owners = new ArrayList<>();
            owners.add(jobSpec.getOwner());
            build.getMetadata().setOwnerReferences(owners);
        }
        return build;
    }

    private static ObjectReference pipelineTagReference(String namespace, String tag) {
        return new ObjectReferenceBuilder()
                .withKind(IMAGE_STREAM_TAG)
                .withNamespace(namespace)
                .withName(RegistryUtil.imageStreamTagName(ModelConstants.PIPELINE_IMAGE_STREAM, tag))
                .build();
    }

    static String sourceDockerfile(String fromTag, String workingDir, CloneAuthConfig cloneAuth) {
        List<String> commands = new ArrayList<>();
        String secretPath = null;
        commands.add("");
        commands.add(String.format("FROM %s:%s", ModelConstants.PIPELINE_IMAGE_STREAM, fromTag));
        commands.add("ADD ./clonerefs /clonerefs");
        if (cloneAuth != null) {
            if (cloneAuth.type() == CloneAuthType.SSH) {
                commands.add(String.format("ADD %s /etc/ssh/ssh_config", SSH_CONFIG));
                commands.add(String.format("COPY ./%s %s", CloneAuthConfig.SSH_PRIVATE_KEY_SECRET_KEY, SSH_PRIVATE_KEY));
                secretPath = SSH_PRIVATE_KEY;
            } else {
                commands.add(String.format("COPY ./%s %s", CloneAuthConfig.OAUTH_TOKEN_SECRET_KEY, OAUTH_TOKEN));
                secretPath = OAUTH_TOKEN;
            }
        }
        commands.add(String.format("RUN umask 0002 && /clonerefs && find %s/src -type d -not -perm -0775 "
                + "| xargs --max-procs 10 --max-args 100 --no-run-if-empty chmod g+xw", GOPATH));
        commands.add(String.format("WORKDIR %s/", workingDir));
        commands.add(String.format("ENV GOPATH=%s", GOPATH));
        //the credential must not survive in the image layers
        if (secretPath != null) {
            commands.add(String.format("RUN rm -f %s", secretPath));
        }
        commands.add("");
        return String.join("\n", commands);
    }

    static String determineWorkDir(String baseDir, List<Refs> refs) {
        if (refs.isEmpty()) {
            return baseDir;
        }
        for (var i : refs) {
            if (i.workDir()) {
                return pathForRefs(baseDir, i);
            }
        }
        return pathForRefs(baseDir, refs.get(0));
    }

    static String pathForRefs(String baseDir, Refs refs) {
        String clonePath;
        if (refs.pathAlias() != null && !refs.pathAlias().isEmpty()) {
            clonePath = refs.pathAlias();
        } else if (refs.repoLink() != null && !refs.repoLink().isEmpty()) {
            clonePath = refs.repoLink().replaceFirst("^https?://", "");
        } else {
            clonePath = String.format("%s/%s/%s", ModelConstants.DEFAULT_GIT_HOST, refs.org(), refs.repo());
        }
        return baseDir + "/src/" + clonePath;
    }

    static Map<String, String> defaultPodLabels(JobSpec jobSpec) {
        Map<String, String> labels = new TreeMap<>();
        labels.put(ModelConstants.JOB_LABEL, nullToEmpty(jobSpec.getJob()));
        labels.put(ModelConstants.BUILD_ID_LABEL, nullToEmpty(jobSpec.getBuildId()));
        labels.put(ModelConstants.PROW_JOB_ID_LABEL, nullToEmpty(jobSpec.getProwJobId()));
        labels.put(ModelConstants.CREATED_BY_CI_LABEL, "true");
        labels.put(ModelConstants.OPENSHIFT_CI_LABEL, "true");
        Refs refs = jobSpec.getRefs();
        if (refs == null && !jobSpec.getExtraRefs().isEmpty()) {
            refs = jobSpec.getExtraRefs().get(0);
        }
        if (refs != null) {
            labels.put(ModelConstants.REFS_ORG_LABEL, nullToEmpty(refs.org()));
            labels.put(ModelConstants.REFS_REPO_LABEL, nullToEmpty(refs.repo()));
            labels.put(ModelConstants.REFS_BRANCH_LABEL, nullToEmpty(refs.baseRef()));
        }
        return ResourceNameUtils.trimLabels(labels);
    }

    /**
     * Labels describing the source of the image. They are always all set, so values inherited from the base
     * image are cleared, and only filled in when the image is built from a single commit.
     */
    static List<ImageLabel> imageLabels(Refs refs, String contextDir) {
        Map<String, String> labels = new TreeMap<>();
        for (var key : IMAGE_LABEL_KEYS) {
            labels.put(key, "");
        }
        if (refs != null && !refs.hasPulls()) {
            String url = String.format("https://%s/%s/%s", ModelConstants.DEFAULT_GIT_HOST, refs.org(), refs.repo());
            labels.put("vcs-type", "git");
            labels.put("vcs-ref", nullToEmpty(refs.baseSha()));
            labels.put("io.openshift.build.commit.id", nullToEmpty(refs.baseSha()));
            labels.put("io.openshift.build.commit.ref", nullToEmpty(refs.baseRef()));
            labels.put("vcs-url", url);
            labels.put("io.openshift.build.source-location", url);
            labels.put("io.openshift.build.source-context-dir", nullToEmpty(contextDir));
        }
        List<ImageLabel> result = new ArrayList<>();
        for (var e : labels.entrySet()) {
            result.add(new ImageLabelBuilder().withName(e.getKey()).withValue(e.getValue()).build());
        }
        return result;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
