package com.nsguard.webhook.model;

/**
 * Admission operations as they appear in {@code request.operation}.
 * Only {@link #DELETE} is guarded; the others are rejected by the adjudicator.
 */
public enum Operation {
    CREATE,
    UPDATE,
    DELETE,
    CONNECT
}
