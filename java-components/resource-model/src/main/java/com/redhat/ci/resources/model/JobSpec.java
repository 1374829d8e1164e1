package com.redhat.ci.resources.model;

import java.util.ArrayList;
import java.util.List;

import io.fabric8.kubernetes.api.model.OwnerReference;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * The job the pipeline runs for. The namespace is only known once the pipeline has set up its
 * namespace, so it is the one mutable part of the spec.
 */
@Getter
@Builder(builderClassName = "Builder")
public class JobSpec {

    private final String type;
    private final String job;
    private final String buildId;
    private final String prowJobId;
    private final Refs refs;
    private final List<Refs> extraRefs;
    private final OwnerReference owner;
    private final String rawSpec;

    @Setter
    private volatile String namespace;

    public List<Refs> getExtraRefs() {
        return extraRefs == null ? List.of() : extraRefs;
    }

    /**
     * Identifies the source this job builds, one entry per repository.
     */
    public List<String> inputs() {
        List<String> result = new ArrayList<>();
        if (refs != null) {
            result.add(refs.describe());
        }
        for (var i : getExtraRefs()) {
            result.add(i.describe());
        }
        return result;
    }
}
