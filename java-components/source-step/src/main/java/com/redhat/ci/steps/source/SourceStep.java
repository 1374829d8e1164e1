package com.redhat.ci.steps.source;

import java.io.PrintStream;
import java.util.List;

import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import com.redhat.ci.resources.model.JobSpec;
import com.redhat.ci.resources.model.ModelConstants;
import com.redhat.ci.resources.model.ResourceConfiguration;
import com.redhat.ci.resources.model.SourceStepConfiguration;
import com.redhat.ci.resources.util.RegistryUtil;
import com.redhat.ci.resources.util.ResourceNameUtils;
import com.redhat.ci.steps.DeferredParameter;
import com.redhat.ci.steps.ParameterMap;
import com.redhat.ci.steps.ParameterResolutionException;
import com.redhat.ci.steps.Step;
import com.redhat.ci.steps.StepContext;
import com.redhat.ci.steps.StepException;
import com.redhat.ci.steps.StepLink;
import com.redhat.ci.steps.build.BuildClient;
import com.redhat.ci.steps.build.BuildFailedException;
import com.redhat.ci.steps.build.BuildLifecycleController;
import com.redhat.ci.steps.build.BuildLifecycleException;
import com.redhat.ci.steps.build.LifecycleSettings;
import com.redhat.ci.steps.resources.MalformedQuantityException;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.openshift.api.model.Build;

/**
 * Clones the job's source code into a new pipeline image, published as the {@code to} tag of the pipeline
 * image stream.
 */
public class SourceStep implements Step {

    private static final Logger log = Logger.getLogger(SourceStep.class);

    public static final String REASON = "cloning_source";

    private final SourceStepConfiguration config;
    private final ResourceConfiguration resources;
    private final BuildClient client;
    private final JobSpec jobSpec;
    private final CloneAuthConfig cloneAuth;
    private final Secret pullSecret;
    private final SourceResolver resolver;
    private final BuildSpecAssembler assembler;
    private final BuildLifecycleController controller;

    public SourceStep(SourceStepConfiguration config, ResourceConfiguration resources, BuildClient client,
            JobSpec jobSpec, CloneAuthConfig cloneAuth, Secret pullSecret, LifecycleSettings settings,
            PrintStream out) {
        this.config = config;
        this.resources = resources;
        this.client = client;
        this.jobSpec = jobSpec;
        this.cloneAuth = cloneAuth;
        this.pullSecret = pullSecret;
        this.resolver = new SourceResolver(client);
        this.assembler = new BuildSpecAssembler();
        this.controller = new BuildLifecycleController(client, settings, out);
    }

    /**
     * Creates the step with settings read from the application configuration, writing build logs to
     * standard output.
     */
    public static SourceStep create(SourceStepConfiguration config, ResourceConfiguration resources,
            BuildClient client, JobSpec jobSpec, CloneAuthConfig cloneAuth, Secret pullSecret) {
        return new SourceStep(config, resources, client, jobSpec, cloneAuth, pullSecret,
                LifecycleSettings.fromConfig(ConfigProvider.getConfig()), System.out);
    }

    @Override
    public List<String> inputs() {
        return jobSpec.inputs();
    }

    @Override
    public void validate() {
    }

    @Override
    public void run(StepContext context) throws StepException {
        try {
            doRun(context);
        } catch (StreamUnresolvableException e) {
            throw new StepException(REASON, "could not resolve clonerefs source: " + e.getMessage(), e);
        } catch (MalformedQuantityException e) {
            throw new StepException(REASON, "unable to parse resource requirement for build " + config.to() + ": "
                    + e.getMessage(), e);
        } catch (BuildFailedException | BuildLifecycleException | RuntimeException e) {
            throw StepException.forReason(REASON, e);
        }
    }

    private void doRun(StepContext context)
            throws StreamUnresolvableException, MalformedQuantityException, BuildFailedException,
            BuildLifecycleException {
        context.checkCancelled();
        ObjectReference clonerefsRef = resolver.resolve(config.clonerefsImage());
        Build build = assembler.createBuild(config, jobSpec, clonerefsRef, resources, cloneAuth, pullSecret);
        log.debugf("Assembled build %s from clonerefs image %s", build.getMetadata().getName(),
                clonerefsRef.getName());
        controller.handleBuild(context, build);
    }

    @Override
    public List<StepLink> requires() {
        return List.of(StepLink.internalImage(config.from()));
    }

    @Override
    public List<StepLink> creates() {
        return List.of(StepLink.internalImage(config.to()));
    }

    /**
     * The digest of the created image is only known once the build has pushed it, so it is looked up
     * every time the parameter is read.
     */
    @Override
    public ParameterMap provides() {
        return ParameterMap.of(new DeferredParameter(ResourceNameUtils.pipelineImageEnvFor(config.to()),
                this::createdImageDigest));
    }

    private String createdImageDigest() throws ParameterResolutionException {
        String tagName = RegistryUtil.imageStreamTagName(ModelConstants.PIPELINE_IMAGE_STREAM, config.to());
        String digest = resolver.imageDigest(jobSpec.getNamespace(), tagName);
        if (digest == null) {
            throw new ParameterResolutionException(String.format("could not retrieve output imagestreamtag %s/%s",
                    jobSpec.getNamespace(), tagName));
        }
        return digest;
    }

    @Override
    public String name() {
        return config.to();
    }

    @Override
    public String description() {
        return String.format("Clone the correct source code into an image and tag it as %s", config.to());
    }

    @Override
    public List<HasMetadata> objects() {
        return client.objects();
    }
}
