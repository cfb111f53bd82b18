package com.nsguard.webhook.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nsguard.webhook.model.ReviewVerdict;

/**
 * The {@code response} half of an AdmissionReview.
 *
 * {@code status.reason} is always written and is empty exactly when the request
 * is allowed. On denial {@code status.message} repeats the reason, since that is
 * the field kubectl prints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdmissionResponse(String uid, boolean allowed, Status status) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Status(String reason, String message) {}

    public static AdmissionResponse from(String uid, ReviewVerdict verdict) {
        Status status = verdict.allowed()
                ? new Status("", null)
                : new Status(verdict.reason(), verdict.reason());
        return new AdmissionResponse(uid, verdict.allowed(), status);
    }
}
