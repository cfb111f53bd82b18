package com.nsguard.webhook.kube;

import java.util.Objects;

/**
 * One row of the workload table: a kind name paired with the query that counts it.
 */
public record CountedKind(String kind, ResourceCounter counter) {

    public CountedKind {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(counter, "counter");
    }
}
