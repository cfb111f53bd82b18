package com.nsguard.webhook.model;

/** A workload kind whose member count could not be determined. */
public record KindFailure(String kind, String error) {

    @Override
    public String toString() {
        return "error listing " + kind + ", " + error;
    }
}
