package com.nsguard.webhook.kube;

/**
 * Thrown when the Kubernetes API server returns an error or is unreachable.
 */
public class ClusterQueryException extends RuntimeException {

    public ClusterQueryException(String message) {
        super(message);
    }

    public ClusterQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
