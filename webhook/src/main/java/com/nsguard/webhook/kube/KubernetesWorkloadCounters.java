package com.nsguard.webhook.kube;

import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.util.List;
import java.util.function.Function;

/**
 * fabric8-backed counters for the workload kinds that keep a namespace alive.
 *
 * The table order is the order kinds appear in denial messages:
 * pods, services, replicasets, deployments, statefulsets, daemonsets,
 * ingresses, horizontalpodautoscalers. Every counter is a plain namespaced
 * list call, so the service account only needs {@code list} on these kinds.
 */
public final class KubernetesWorkloadCounters {

    private KubernetesWorkloadCounters() {
    }

    public static List<CountedKind> table(KubernetesClient client) {
        return List.of(
                kind("pods",                     ns -> client.pods().inNamespace(ns).list()),
                kind("services",                 ns -> client.services().inNamespace(ns).list()),
                kind("replicasets",              ns -> client.apps().replicaSets().inNamespace(ns).list()),
                kind("deployments",              ns -> client.apps().deployments().inNamespace(ns).list()),
                kind("statefulsets",             ns -> client.apps().statefulSets().inNamespace(ns).list()),
                kind("daemonsets",               ns -> client.apps().daemonSets().inNamespace(ns).list()),
                kind("ingresses",                ns -> client.network().v1().ingresses().inNamespace(ns).list()),
                kind("horizontalpodautoscalers", ns -> client.autoscaling().v1().horizontalPodAutoscalers().inNamespace(ns).list())
        );
    }

    private static CountedKind kind(String kind, Function<String, KubernetesResourceList<?>> lister) {
        return new CountedKind(kind, namespace -> {
            try {
                return lister.apply(namespace).getItems().size();
            } catch (KubernetesClientException e) {
                throw new ClusterQueryException(e.getMessage(), e);
            }
        });
    }
}
