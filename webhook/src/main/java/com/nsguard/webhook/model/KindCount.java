package com.nsguard.webhook.model;

/** A workload kind that still has {@code count} members in the namespace. */
public record KindCount(String kind, int count) {

    @Override
    public String toString() {
        return kind + "(" + count + ")";
    }
}
