package com.nsguard.webhook.kube;

import java.util.Optional;

/**
 * Looks up namespaces by name.
 */
public interface NamespaceDirectory {

    /**
     * @return the namespace, or empty if the API server reports it does not exist
     * @throws ClusterQueryException for every failure other than not-found
     */
    Optional<NamespaceRecord> find(String name);
}
