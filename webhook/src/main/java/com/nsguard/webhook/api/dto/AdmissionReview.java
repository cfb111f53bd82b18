package com.nsguard.webhook.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The {@code admission.k8s.io/v1} AdmissionReview envelope.
 *
 * The API server sends it with {@code request} set; the webhook answers with
 * the same apiVersion/kind and {@code response} set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdmissionReview(
        String            apiVersion,
        String            kind,
        AdmissionRequest  request,
        AdmissionResponse response
) {
    public static final String API_VERSION = "admission.k8s.io/v1";
    public static final String KIND        = "AdmissionReview";

    /** Build the reply to this review, echoing its apiVersion and kind. */
    public AdmissionReview reply(AdmissionResponse response) {
        return new AdmissionReview(
                apiVersion != null ? apiVersion : API_VERSION,
                kind != null ? kind : KIND,
                null,
                response);
    }

    /** Reply to a request whose body could not be decoded. */
    public static AdmissionReview replyTo(AdmissionResponse response) {
        return new AdmissionReview(API_VERSION, KIND, null, response);
    }
}
