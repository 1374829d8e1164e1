package com.redhat.ci.steps.source;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redhat.ci.resources.model.Refs;

import lombok.Builder;

/**
 * The options the clonerefs tool reads from its environment.
 */
@Builder(builderClassName = "Builder")
@JsonPropertyOrder({ "src_root", "log", "git_user_name", "git_user_email", "refs", "key_files", "oauth_token_file",
        "fail" })
public record CloneRefsOptions(
        @JsonProperty("src_root") String srcRoot,
        @JsonProperty("log") String log,
        @JsonProperty("git_user_name") @JsonInclude(JsonInclude.Include.NON_EMPTY) String gitUserName,
        @JsonProperty("git_user_email") @JsonInclude(JsonInclude.Include.NON_EMPTY) String gitUserEmail,
        @JsonProperty("refs") List<Refs> refs,
        @JsonProperty("key_files") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> keyFiles,
        @JsonProperty("oauth_token_file") @JsonInclude(JsonInclude.Include.NON_EMPTY) String oauthTokenFile,
        @JsonProperty("fail") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean fail) {

    public static final String JSON_CONFIG_ENV_VAR = "CLONEREFS_OPTIONS";

    static final String DEFAULT_GIT_USER_NAME = "ci-robot";
    static final String DEFAULT_GIT_USER_EMAIL = "ci-robot@openshift.io";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String encode() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Couldn't create JSON spec for clonerefs", e);
        }
    }

    public static CloneRefsOptions decode(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, CloneRefsOptions.class);
    }
}
