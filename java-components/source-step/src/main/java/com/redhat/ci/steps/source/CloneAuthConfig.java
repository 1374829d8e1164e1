package com.redhat.ci.steps.source;

import java.util.Objects;

import com.redhat.ci.resources.model.ModelConstants;

/**
 * Credentials for cloning private repositories: the secret holding them and how they are used.
 */
public record CloneAuthConfig(String secretName, CloneAuthType type) {

    static final String SSH_PRIVATE_KEY_SECRET_KEY = "ssh-privatekey";
    static final String OAUTH_TOKEN_SECRET_KEY = "oauth-token";

    public CloneAuthConfig {
        Objects.requireNonNull(secretName, "secretName");
        Objects.requireNonNull(type, "type");
    }

    public static CloneAuthConfig ssh(String secretName) {
        return new CloneAuthConfig(secretName, CloneAuthType.SSH);
    }

    public static CloneAuthConfig oauth(String secretName) {
        return new CloneAuthConfig(secretName, CloneAuthType.OAUTH);
    }

    /**
     * The URI to clone the repository from with these credentials.
     */
    public String cloneUri(String org, String repo) {
        if (type == CloneAuthType.SSH) {
            return String.format("ssh://git@%s/%s/%s.git", ModelConstants.DEFAULT_GIT_HOST, org, repo);
        }
        return String.format("https://%s/%s/%s.git", ModelConstants.DEFAULT_GIT_HOST, org, repo);
    }

    /**
     * The key inside the secret that holds the credential.
     */
    public String secretKey() {
        return type == CloneAuthType.SSH ? SSH_PRIVATE_KEY_SECRET_KEY : OAUTH_TOKEN_SECRET_KEY;
    }
}
