package com.nsguard.webhook.kube;

/**
 * Counts the members of one namespaced resource collection.
 * Implementations must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface ResourceCounter {

    /**
     * @throws ClusterQueryException if the collection cannot be listed
     */
    int count(String namespace);
}
