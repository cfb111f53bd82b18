package com.nsguard.webhook.api;

import com.nsguard.webhook.service.AdmissionAdjudicator;
import com.nsguard.webhook.service.AdmissionOutcome;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admission webhook endpoint.
 *
 * POST /  — AdmissionReview in, AdmissionReview out
 *
 * Every other method and path is routed here too, so the adjudicator can
 * answer 405/404 itself instead of the framework's default error pages.
 */
@RestController
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final AdmissionAdjudicator adjudicator;

    public AdmissionController(AdmissionAdjudicator adjudicator) {
        this.adjudicator = adjudicator;
    }

    @RequestMapping("/**")
    public ResponseEntity<?> review(HttpServletRequest request,
                                    @RequestBody(required = false) byte[] body) {
        log.info("Serving {} {} request for client: {}",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr());

        AdmissionOutcome outcome = adjudicator.adjudicate(request.getMethod(), request.getRequestURI(), body);
        if (outcome.hasReview()) {
            return ResponseEntity.status(outcome.status())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(outcome.review());
        }
        return ResponseEntity.status(outcome.status())
                .contentType(MediaType.TEXT_PLAIN)
                .body(outcome.plainText());
    }
}
