package com.redhat.ci.resources.util;

public class RegistryUtil {

    /**
     * The name of an image stream tag object, {@code stream:tag}.
     */
    public static String imageStreamTagName(String stream, String tag) {
        return stream + ":" + tag;
    }

    /**
     * A pull spec pinned to a content digest, {@code repository@sha256:...}.
     */
    public static String digestPullSpec(String repository, String digest) {
        return repository + "@" + digest;
    }
}
