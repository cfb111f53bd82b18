package com.nsguard.webhook.service;

import com.nsguard.webhook.kube.ClusterQueryException;
import com.nsguard.webhook.kube.CountedKind;
import com.nsguard.webhook.kube.ResourceCounter;
import com.nsguard.webhook.model.KindCount;
import com.nsguard.webhook.model.KindFailure;
import com.nsguard.webhook.model.ResourceTally;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for WorkloadInventory.
 * Counters are in-memory fakes; no cluster and no Spring context.
 */
class WorkloadInventoryTest {

    static final List<String> KINDS = List.of(
            "pods", "services", "replicasets", "deployments",
            "statefulsets", "daemonsets", "ingresses", "horizontalpodautoscalers");

    ExecutorService    workers;
    SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        workers       = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Clear namespaces
    // ------------------------------------------------------------------

    @Test
    void evaluate_allKindsEmpty_isClear() {
        WorkloadInventory inventory = inventory(Map.of());

        ResourceTally tally = inventory.evaluate("ns1");

        assertThat(tally.isClear()).isTrue();
        assertThat(tally.namespace()).isEqualTo("ns1");
    }

    @Test
    void evaluate_recordsDuration() {
        inventory(Map.of()).evaluate("ns1");

        assertThat(meterRegistry.timer("nsguard.inventory.duration").count()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Non-empty kinds
    // ------------------------------------------------------------------

    @Test
    void evaluate_singlePod_reportsOnlyPods() {
        WorkloadInventory inventory = inventory(Map.of("pods", ns -> 1));

        ResourceTally tally = inventory.evaluate("ns1");

        assertThat(tally.nonEmpty()).containsExactly(new KindCount("pods", 1));
        assertThat(tally.failures()).isEmpty();
        assertThat(tally.denialMessage()).contains("[pods(1)]");
        KINDS.stream().filter(k -> !k.equals("pods"))
                .forEach(k -> assertThat(tally.denialMessage()).doesNotContain(k + "("));
    }

    @Test
    void evaluate_everyKindPopulated_listsAllInFixedOrder() {
        Map<String, ResourceCounter> counters = new HashMap<>();
        KINDS.forEach(k -> counters.put(k, ns -> 1));

        ResourceTally tally = inventory(counters).evaluate("ns1");

        assertThat(tally.nonEmpty()).extracting(KindCount::kind).containsExactlyElementsOf(KINDS);
        assertThat(tally.denialMessage()).contains(
                "[pods(1) services(1) replicasets(1) deployments(1) statefulsets(1) "
                + "daemonsets(1) ingresses(1) horizontalpodautoscalers(1)]");
    }

    @Test
    void evaluate_resultOrderIndependentOfCompletionOrder() {
        CountDownLatch servicesDone = new CountDownLatch(1);
        Map<String, ResourceCounter> counters = new HashMap<>();
        counters.put("pods", ns -> {
            await(servicesDone);     // pods finishes last
            return 2;
        });
        counters.put("services", ns -> {
            servicesDone.countDown();
            return 5;
        });

        ResourceTally tally = inventory(counters).evaluate("ns1");

        assertThat(tally.nonEmpty()).containsExactly(new KindCount("pods", 2), new KindCount("services", 5));
    }

    @Test
    void evaluate_queriesEveryKindEvenAfterFirstNonEmpty() {
        AtomicInteger calls = new AtomicInteger();
        Map<String, ResourceCounter> counters = new HashMap<>();
        KINDS.forEach(k -> counters.put(k, ns -> {
            calls.incrementAndGet();
            return k.equals("pods") ? 4 : 0;
        }));

        inventory(counters).evaluate("ns1");

        assertThat(calls.get()).isEqualTo(KINDS.size());
    }

    @Test
    void evaluate_passesNamespaceToEveryCounter() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        Map<String, ResourceCounter> counters = new HashMap<>();
        KINDS.forEach(k -> counters.put(k, ns -> {
            seen.add(ns);
            return 0;
        }));

        inventory(counters).evaluate("team-a");

        assertThat(seen).hasSize(KINDS.size()).containsOnly("team-a");
    }

    // ------------------------------------------------------------------
    // Query failures
    // ------------------------------------------------------------------

    @Test
    void evaluate_failingKind_isRecordedAndOthersStillCounted() {
        Map<String, ResourceCounter> counters = new HashMap<>();
        counters.put("services", ns -> { throw new ClusterQueryException("services is forbidden"); });
        counters.put("daemonsets", ns -> 2);

        ResourceTally tally = inventory(counters).evaluate("ns1");

        assertThat(tally.nonEmpty()).containsExactly(new KindCount("daemonsets", 2));
        assertThat(tally.failures()).containsExactly(new KindFailure("services", "services is forbidden"));
    }

    @Test
    void evaluate_failureWithEverythingElseEmpty_isNotClear() {
        Map<String, ResourceCounter> counters = new HashMap<>();
        counters.put("horizontalpodautoscalers", ns -> { throw new IllegalStateException("connection reset"); });

        ResourceTally tally = inventory(counters).evaluate("ns1");

        assertThat(tally.isClear()).isFalse();
        assertThat(tally.denialMessage()).contains("error listing horizontalpodautoscalers, connection reset");
    }

    @Test
    void evaluate_multipleFailures_keepFixedOrder() {
        Map<String, ResourceCounter> counters = new HashMap<>();
        counters.put("ingresses", ns -> { throw new ClusterQueryException("b"); });
        counters.put("pods", ns -> { throw new ClusterQueryException("a"); });

        ResourceTally tally = inventory(counters).evaluate("ns1");

        assertThat(tally.failures()).extracting(KindFailure::kind).containsExactly("pods", "ingresses");
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void evaluate_interrupted_throwsCancelledAndAbandonsQueries() throws Exception {
        CountDownLatch started   = new CountDownLatch(1);
        CountDownLatch abandoned = new CountDownLatch(1);
        Map<String, ResourceCounter> counters = new HashMap<>();
        counters.put("pods", ns -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                abandoned.countDown();
                Thread.currentThread().interrupt();
            }
            throw new ClusterQueryException("interrupted");
        });
        WorkloadInventory inventory = inventory(counters);

        AtomicReference<Object> outcome = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                outcome.set(inventory.evaluate("ns1"));
            } catch (RuntimeException e) {
                outcome.set(e);
            }
        });
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(5000);

        assertThat(outcome.get()).isInstanceOf(EvaluationCancelledException.class);
        assertThat(abandoned.await(5, TimeUnit.SECONDS)).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Builds the fixed kind table; kinds without an explicit counter report 0. */
    private WorkloadInventory inventory(Map<String, ResourceCounter> overrides) {
        List<CountedKind> table = KINDS.stream()
                .map(k -> new CountedKind(k, overrides.getOrDefault(k, ns -> 0)))
                .toList();
        return new WorkloadInventory(table, workers, meterRegistry);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
