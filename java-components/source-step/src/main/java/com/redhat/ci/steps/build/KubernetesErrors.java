package com.redhat.ci.steps.build;

import java.net.HttpURLConnection;

import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Classifies API errors by their status.
 */
public final class KubernetesErrors {

    static final String REASON_ALREADY_EXISTS = "AlreadyExists";
    static final String REASON_CONFLICT = "Conflict";

    private KubernetesErrors() {
    }

    public static boolean isNotFound(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }

    /**
     * A 409 reporting that an object of that name exists. A 409 caused by a failed precondition is a
     * conflict, not this.
     */
    public static boolean isAlreadyExists(KubernetesClientException e) {
        if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
            return false;
        }
        String reason = reason(e);
        return reason == null || REASON_ALREADY_EXISTS.equals(reason);
    }

    public static boolean isConflict(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_CONFLICT && !REASON_ALREADY_EXISTS.equals(reason(e));
    }

    private static String reason(KubernetesClientException e) {
        return e.getStatus() == null ? null : e.getStatus().getReason();
    }
}
