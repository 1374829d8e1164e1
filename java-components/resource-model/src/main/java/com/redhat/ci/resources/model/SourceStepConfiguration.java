package com.redhat.ci.resources.model;

import lombok.Builder;

/**
 * Configuration of the step that clones source code into the {@code to} pipeline image, starting from
 * the {@code from} pipeline image.
 *
 * @param from the pipeline tag the build starts from
 * @param to the pipeline tag the cloned source is published as
 * @param clonerefsImage the image holding the clonerefs binary
 * @param clonerefsPath the path of the clonerefs binary inside {@code clonerefsImage}
 */
@Builder(builderClassName = "Builder")
public record SourceStepConfiguration(String from, String to, ImageStreamTagReference clonerefsImage,
        String clonerefsPath) {

}
