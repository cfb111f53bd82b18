package com.nsguard.webhook;

import com.nsguard.webhook.kube.CountedKind;
import com.nsguard.webhook.kube.KubernetesNamespaceDirectory;
import com.nsguard.webhook.kube.KubernetesWorkloadCounters;
import com.nsguard.webhook.kube.NamespaceDirectory;
import com.nsguard.webhook.service.WorkloadInventory;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the cluster-facing collaborators of the adjudicator.
 */
@Configuration
public class WebhookConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WebhookConfiguration.class);

    /**
     * Cluster client. fabric8 picks up the in-cluster service account when
     * running as a pod, or the local kubeconfig otherwise.
     */
    @Bean(destroyMethod = "close")
    KubernetesClient kubernetesClient() {
        KubernetesClient client = new KubernetesClientBuilder().build();
        log.info("Kubernetes client targets {}", client.getMasterUrl());
        return client;
    }

    @Bean
    NamespaceDirectory namespaceDirectory(KubernetesClient client) {
        return new KubernetesNamespaceDirectory(client);
    }

    @Bean
    List<CountedKind> workloadKinds(KubernetesClient client) {
        return KubernetesWorkloadCounters.table(client);
    }

    // One list call per kind; the pool caps how many run at once across requests.
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService inventoryWorkers(@Value("${nsguard.inventory.workers:8}") int workers) {
        return Executors.newFixedThreadPool(workers);
    }

    @Bean
    WorkloadInventory workloadInventory(List<CountedKind> workloadKinds,
                                        ExecutorService inventoryWorkers,
                                        MeterRegistry meterRegistry) {
        return new WorkloadInventory(workloadKinds, inventoryWorkers, meterRegistry);
    }
}
