package com.redhat.ci.resources.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * A pull request merged on top of the base ref before the source is built.
 */
@Builder(builderClassName = "Builder")
@JsonIgnoreProperties(ignoreUnknown = true)
public record Pull(
        @JsonProperty("number") int number,
        @JsonProperty("author") String author,
        @JsonProperty("sha") String sha,
        @JsonProperty("title") @JsonInclude(JsonInclude.Include.NON_EMPTY) String title,
        @JsonProperty("ref") @JsonInclude(JsonInclude.Include.NON_EMPTY) String ref,
        @JsonProperty("link") @JsonInclude(JsonInclude.Include.NON_EMPTY) String link,
        @JsonProperty("commit_link") @JsonInclude(JsonInclude.Include.NON_EMPTY) String commitLink,
        @JsonProperty("author_link") @JsonInclude(JsonInclude.Include.NON_EMPTY) String authorLink) {

}
