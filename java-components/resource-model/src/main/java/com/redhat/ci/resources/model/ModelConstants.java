package com.redhat.ci.resources.model;

public class ModelConstants {
    public static final String GROUP = "ci.openshift.io";

    public static final String PIPELINE_IMAGE_STREAM = "pipeline";

    public static final String JOB_SPEC_ANNOTATION = GROUP + "/job-spec";

    public static final String JOB_LABEL = "job";
    public static final String BUILD_ID_LABEL = "build-id";
    public static final String CREATES_LABEL = "creates";
    public static final String CREATED_BY_CI_LABEL = "created-by-ci";
    public static final String PROW_JOB_ID_LABEL = "prow.k8s.io/id";
    public static final String OPENSHIFT_CI_LABEL = "OPENSHIFT_CI";

    public static final String REFS_ORG_LABEL = GROUP + "/refs.org";
    public static final String REFS_REPO_LABEL = GROUP + "/refs.repo";
    public static final String REFS_BRANCH_LABEL = GROUP + "/refs.branch";

    public static final String BUILD_POD_NAME_ANNOTATION = "openshift.io/build.pod-name";

    public static final String PULL_SECRET_NAME = "registry-pull-credentials";

    public static final String DEFAULT_GIT_HOST = "github.com";

}
