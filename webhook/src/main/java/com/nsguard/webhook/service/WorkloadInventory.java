package com.nsguard.webhook.service;

import com.nsguard.webhook.kube.CountedKind;
import com.nsguard.webhook.model.KindCount;
import com.nsguard.webhook.model.KindFailure;
import com.nsguard.webhook.model.ResourceTally;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Counts the workload resources left in a namespace.
 *
 * Every kind in the table is queried, concurrently, on the shared worker pool.
 * Results are read back in table order once all queries have finished, so the
 * tally never depends on which query returned first. A failing query is
 * recorded as a {@link KindFailure} and does not stop the other kinds from
 * being counted; there are no retries.
 */
public class WorkloadInventory {

    private static final Logger log = LoggerFactory.getLogger(WorkloadInventory.class);

    private final List<CountedKind> kinds;
    private final ExecutorService   workers;
    private final MeterRegistry     meterRegistry;

    public WorkloadInventory(List<CountedKind> kinds, ExecutorService workers, MeterRegistry meterRegistry) {
        this.kinds         = List.copyOf(kinds);
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
    }

    /** Kind names in the order they are reported. */
    public List<String> kindNames() {
        return kinds.stream().map(CountedKind::kind).toList();
    }

    /**
     * Inventory one namespace.
     *
     * @throws EvaluationCancelledException if the calling thread is interrupted
     *         while queries are in flight; outstanding queries are cancelled
     */
    public ResourceTally evaluate(String namespace) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<Future<Integer>> pending = new ArrayList<>(kinds.size());
        for (CountedKind kind : kinds) {
            pending.add(workers.submit(() -> kind.counter().count(namespace)));
        }

        List<KindCount>   nonEmpty = new ArrayList<>();
        List<KindFailure> failures = new ArrayList<>();
        try {
            for (int i = 0; i < kinds.size(); i++) {
                String kind = kinds.get(i).kind();
                try {
                    int count = pending.get(i).get();
                    log.debug("Namespace {} has {} {}", namespace, count, kind);
                    if (count > 0) {
                        nonEmpty.add(new KindCount(kind, count));
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Could not count {} in namespace {}: {}", kind, namespace, cause.getMessage());
                    failures.add(new KindFailure(kind, String.valueOf(cause.getMessage())));
                }
            }
        } catch (InterruptedException e) {
            pending.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new EvaluationCancelledException(namespace, e);
        } finally {
            sample.stop(meterRegistry.timer("nsguard.inventory.duration"));
        }
        return new ResourceTally(namespace, nonEmpty, failures);
    }
}
