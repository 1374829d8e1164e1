package com.redhat.ci.steps;

import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * A node of the pipeline graph. The graph orders steps through the links they require and create, and
 * hands the parameters a step provides to the steps that run after it.
 */
public interface Step {

    /**
     * Identifies the content this step consumes, used to decide whether a previous result can be reused.
     */
    List<String> inputs();

    /**
     * Checks the step can run, before anything is executed.
     */
    void validate() throws StepException;

    void run(StepContext context) throws StepException;

    List<StepLink> requires();

    List<StepLink> creates();

    ParameterMap provides();

    String name();

    String description();

    /**
     * The cluster objects this step has created so far.
     */
    List<HasMetadata> objects();
}
