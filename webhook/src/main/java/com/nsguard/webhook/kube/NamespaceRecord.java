package com.nsguard.webhook.kube;

import java.util.Map;

/**
 * The parts of a Namespace object the adjudicator reads.
 *
 * @param annotations never null; empty when the namespace has none
 */
public record NamespaceRecord(String name, Map<String, String> annotations) {

    public NamespaceRecord {
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public String annotation(String key) {
        return annotations.get(key);
    }
}
