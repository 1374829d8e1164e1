package com.redhat.ci.resources.model;

import lombok.Builder;

@Builder(builderClassName = "Builder")
public record ImageStreamTagReference(String namespace, String name, String tag) {

    public String displayName() {
        return namespace + "/" + name + ":" + tag;
    }
}
