package com.nsguard.webhook.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The (group, version, resource) triple that identifies the API collection
 * a review request targets. The core group is the empty string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupVersionResource(String group, String version, String resource) {

    /** The only collection this webhook guards: core/v1 namespaces. */
    public static final GroupVersionResource NAMESPACES =
            new GroupVersionResource("", "v1", "namespaces");

    // Jackson leaves absent fields null; the core group is "" on the wire.
    public GroupVersionResource {
        if (group == null) group = "";
        if (version == null) version = "";
        if (resource == null) resource = "";
    }

    /** Renders as {@code {group version resource}}, e.g. {@code { v1 namespaces}}. */
    @Override
    public String toString() {
        return "{" + group + " " + version + " " + resource + "}";
    }
}
