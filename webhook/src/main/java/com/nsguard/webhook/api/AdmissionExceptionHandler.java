package com.nsguard.webhook.api;

import com.nsguard.webhook.service.EvaluationCancelledException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures that escape adjudication to HTTP responses.
 *
 * A cancelled inventory has no verdict, so the API server gets a 503 and
 * applies the webhook's failurePolicy.
 */
@RestControllerAdvice
public class AdmissionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AdmissionExceptionHandler.class);

    @ExceptionHandler(EvaluationCancelledException.class)
    public ResponseEntity<String> handleCancelled(EvaluationCancelledException ex, HttpServletRequest request) {
        log.warn("No verdict for {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.TEXT_PLAIN)
                .body(ex.getMessage());
    }
}
