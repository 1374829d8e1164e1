package com.redhat.ci.steps;

import com.redhat.ci.resources.model.ModelConstants;

/**
 * A dependency edge of the pipeline graph: a tag of an image stream that one step creates and others
 * require.
 */
public record StepLink(String imageStream, String tag) {

    /**
     * A link to a tag of the pipeline's own image stream.
     */
    public static StepLink internalImage(String tag) {
        return new StepLink(ModelConstants.PIPELINE_IMAGE_STREAM, tag);
    }
}
