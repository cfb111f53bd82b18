package com.nsguard.webhook.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.nsguard.webhook.model.GroupVersionResource;
import com.nsguard.webhook.model.Operation;

/**
 * The {@code request} half of an AdmissionReview. Only the fields the guard
 * reads are declared; the rest of the payload is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdmissionRequest(
        String               uid,
        GroupVersionResource resource,
        String               name,
        String               namespace,
        Operation            operation,
        UserInfo             userInfo,
        JsonNode             object
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserInfo(String username, String uid) {}
}
