package com.nsguard.webhook.service;

/**
 * Thrown when an inventory is interrupted before every kind has been counted.
 * No verdict is produced for a cancelled evaluation.
 */
public class EvaluationCancelledException extends RuntimeException {

    public EvaluationCancelledException(String namespace, Throwable cause) {
        super("Workload inventory of namespace " + namespace + " was cancelled", cause);
    }
}
