package com.redhat.ci.resources.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * Describes one repository to check out: the base ref and any pull requests to merge on top of it.
 * <p>
 * The JSON form is the one understood by the clonerefs tool, so the property names must not change.
 */
@Builder(builderClassName = "Builder", toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Refs(
        @JsonProperty("org") String org,
        @JsonProperty("repo") String repo,
        @JsonProperty("repo_link") @JsonInclude(JsonInclude.Include.NON_EMPTY) String repoLink,
        @JsonProperty("base_ref") String baseRef,
        @JsonProperty("base_sha") @JsonInclude(JsonInclude.Include.NON_EMPTY) String baseSha,
        @JsonProperty("base_link") @JsonInclude(JsonInclude.Include.NON_EMPTY) String baseLink,
        @JsonProperty("pulls") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Pull> pulls,
        @JsonProperty("path_alias") @JsonInclude(JsonInclude.Include.NON_EMPTY) String pathAlias,
        @JsonProperty("workdir") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean workDir,
        @JsonProperty("clone_uri") @JsonInclude(JsonInclude.Include.NON_EMPTY) String cloneUri,
        @JsonProperty("skip_submodules") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean skipSubmodules,
        @JsonProperty("clone_depth") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int cloneDepth,
        @JsonProperty("skip_fetch_head") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean skipFetchHead) {

    @JsonIgnore
    public boolean hasPulls() {
        return pulls != null && !pulls.isEmpty();
    }

    /**
     * The URI the clone tool will fetch from: the explicit clone URI, or the public GitHub HTTPS URI.
     */
    @JsonIgnore
    public String effectiveCloneUri() {
        if (cloneUri != null && !cloneUri.isEmpty()) {
            return cloneUri;
        }
        return String.format("https://%s/%s/%s.git", ModelConstants.DEFAULT_GIT_HOST, org, repo);
    }

    /**
     * Short form used to identify the inputs of a build, e.g. {@code main:abc123,42:def456}.
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (baseSha != null && !baseSha.isEmpty()) {
            parts.add(baseRef + ":" + baseSha);
        } else {
            parts.add(baseRef);
        }
        if (pulls != null) {
            for (var pull : pulls) {
                String ref = pull.number() + ":" + pull.sha();
                if (pull.ref() != null && !pull.ref().isEmpty()) {
                    ref = ref + ":" + pull.ref();
                }
                parts.add(ref);
            }
        }
        return String.join(",", parts);
    }
}
