package com.nsguard.webhook.kube;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpURLConnection;
import java.util.Optional;

/**
 * Namespace lookups through the fabric8 client.
 *
 * fabric8 maps a 404 on {@code get()} to {@code null}; a 404 surfacing as an
 * exception (some proxies do this) is treated the same way.
 */
public class KubernetesNamespaceDirectory implements NamespaceDirectory {

    private static final Logger log = LoggerFactory.getLogger(KubernetesNamespaceDirectory.class);

    private final KubernetesClient client;

    public KubernetesNamespaceDirectory(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<NamespaceRecord> find(String name) {
        if (name == null || name.isBlank()) {
            throw new ClusterQueryException("namespace name must be provided");
        }
        Namespace namespace;
        try {
            namespace = client.namespaces().withName(name).get();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                log.debug("Namespace {} not found: {}", name, e.getMessage());
                return Optional.empty();
            }
            throw new ClusterQueryException(e.getMessage(), e);
        }
        if (namespace == null) {
            return Optional.empty();
        }
        return Optional.of(new NamespaceRecord(
                namespace.getMetadata().getName(),
                namespace.getMetadata().getAnnotations()));
    }
}
