package com.nsguard.webhook.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for the kubelet. Always answers 200 OK.
 */
@RestController
public class StatusController {

    @GetMapping(path = "/status.html", produces = MediaType.TEXT_PLAIN_VALUE)
    public String status() {
        return "OK";
    }
}
