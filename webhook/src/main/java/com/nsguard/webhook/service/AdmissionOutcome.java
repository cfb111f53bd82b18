package com.nsguard.webhook.service;

import com.nsguard.webhook.api.dto.AdmissionReview;
import org.springframework.http.HttpStatus;

/**
 * What the transport layer writes back for one inbound call: either a review
 * envelope carrying a verdict, or a plain-text transport error (wrong method
 * or path) that never reached the verdict stage.
 */
public record AdmissionOutcome(HttpStatus status, AdmissionReview review, String plainText) {

    public static AdmissionOutcome review(HttpStatus status, AdmissionReview review) {
        return new AdmissionOutcome(status, review, null);
    }

    public static AdmissionOutcome plain(HttpStatus status, String text) {
        return new AdmissionOutcome(status, null, text);
    }

    public boolean hasReview() {
        return review != null;
    }
}
