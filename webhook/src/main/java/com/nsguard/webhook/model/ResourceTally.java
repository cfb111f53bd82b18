package com.nsguard.webhook.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one workload inventory of a namespace.
 *
 * Both lists follow the fixed kind order the inventory was built with, not the
 * order in which the underlying queries completed, so the denial text is
 * reproducible. A kind whose query failed is never reported as empty: any
 * failure makes the tally non-clear.
 *
 * @param namespace namespace that was inventoried
 * @param nonEmpty  kinds with at least one member
 * @param failures  kinds whose count could not be determined
 */
public record ResourceTally(String namespace, List<KindCount> nonEmpty, List<KindFailure> failures) {

    /** Annotation an operator sets on a namespace to skip the inventory check. */
    public static final String BYPASS_ANNOTATION_KEY =
            "k8s-namespace-guard.admission.yahoo.com/allow-cascade-delete";

    /** The only annotation value that enables the bypass. */
    public static final String BYPASS_ANNOTATION_VALUE = "true";

    public ResourceTally {
        nonEmpty = List.copyOf(nonEmpty);
        failures = List.copyOf(failures);
    }

    /** True when every kind was confirmed empty. */
    public boolean isClear() {
        return nonEmpty.isEmpty() && failures.isEmpty();
    }

    /**
     * Human-readable denial naming every non-empty kind with its count, every
     * query failure, and the command that bypasses the check.
     *
     * @throws IllegalStateException if the tally is clear
     */
    public String denialMessage() {
        if (isClear()) {
            throw new IllegalStateException("Namespace " + namespace + " is clear; nothing to deny");
        }
        StringBuilder sb = new StringBuilder();
        if (!nonEmpty.isEmpty()) {
            sb.append("The namespace ").append(namespace)
              .append(" you are trying to remove contains one or more of these resources: ")
              .append(bracketed(nonEmpty))
              .append(". Please delete them and try again.");
        }
        if (!failures.isEmpty()) {
            sb.append("The following error(s) occurred while validating the DELETE operation on the namespace ")
              .append(namespace).append(": ")
              .append(bracketed(failures))
              .append('.');
        }
        sb.append(" WARNING: If you know what you are doing, run `kubectl annotate namespace ")
          .append(namespace).append(' ')
          .append(BYPASS_ANNOTATION_KEY).append('=').append(BYPASS_ANNOTATION_VALUE)
          .append("` to bypass this policy check.");
        return sb.toString();
    }

    // Entries are space separated; failure entries already contain ", ".
    private static String bracketed(List<?> entries) {
        return entries.stream().map(Object::toString).collect(Collectors.joining(" ", "[", "]"));
    }
}
