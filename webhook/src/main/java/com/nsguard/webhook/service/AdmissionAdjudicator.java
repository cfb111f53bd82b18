package com.nsguard.webhook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nsguard.webhook.api.dto.AdmissionRequest;
import com.nsguard.webhook.api.dto.AdmissionResponse;
import com.nsguard.webhook.api.dto.AdmissionReview;
import com.nsguard.webhook.kube.ClusterQueryException;
import com.nsguard.webhook.kube.NamespaceDirectory;
import com.nsguard.webhook.kube.NamespaceRecord;
import com.nsguard.webhook.model.GroupVersionResource;
import com.nsguard.webhook.model.Operation;
import com.nsguard.webhook.model.ResourceTally;
import com.nsguard.webhook.model.ReviewRequest;
import com.nsguard.webhook.model.ReviewVerdict;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Decides whether a namespace deletion may proceed.
 *
 * Gates run in a fixed order and the first one that reaches a verdict wins:
 * <ol>
 *   <li>method must be POST (405 otherwise)</li>
 *   <li>path must be {@code /} (404 otherwise)</li>
 *   <li>body must decode as an AdmissionReview with a request (400 otherwise)</li>
 *   <li>admit-all override allows everything</li>
 *   <li>resource must be core/v1 namespaces, else deny</li>
 *   <li>operation must be DELETE, else deny</li>
 *   <li>namespace lookup: not found allows, any other error denies</li>
 *   <li>bypass annotation set to exactly {@code "true"} allows</li>
 *   <li>workload inventory: clear allows, anything else denies</li>
 * </ol>
 * Requests that are not namespace deletions are denied rather than ignored.
 */
@Service
public class AdmissionAdjudicator {

    private static final Logger log = LoggerFactory.getLogger(AdmissionAdjudicator.class);

    static final String WEBHOOK_PATH   = "/";
    static final String DECODE_FAILURE =
            "Failed to decode the request body json into an AdmissionReview resource: ";

    private final NamespaceDirectory namespaces;
    private final WorkloadInventory  inventory;
    private final ObjectMapper       json;
    private final MeterRegistry      meterRegistry;
    private final boolean            admitAll;

    public AdmissionAdjudicator(NamespaceDirectory namespaces,
                                WorkloadInventory inventory,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry,
                                @Value("${nsguard.admit-all:false}") boolean admitAll) {
        this.namespaces    = namespaces;
        this.inventory     = inventory;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.admitAll      = admitAll;
        if (admitAll) {
            log.warn("admitAll is enabled: every namespace deletion will be allowed without validation.");
        }
    }

    /** A verdict plus the gate that produced it, for logs and metrics. */
    record Decision(ReviewVerdict verdict, String gate) {}

    // ------------------------------------------------------------------
    // Transport-level gates
    // ------------------------------------------------------------------

    /**
     * Adjudicate one inbound call.
     *
     * @param method HTTP method of the call
     * @param path   request path
     * @param body   raw request body, may be null or empty
     * @throws EvaluationCancelledException if the thread is interrupted during the inventory
     */
    public AdmissionOutcome adjudicate(String method, String path, byte[] body) {
        if (!HttpMethod.POST.matches(method)) {
            return AdmissionOutcome.plain(HttpStatus.METHOD_NOT_ALLOWED,
                    "Incoming request method " + method + " is not supported, only POST is supported");
        }
        if (!WEBHOOK_PATH.equals(path)) {
            return AdmissionOutcome.plain(HttpStatus.NOT_FOUND, path + " 404 Not Found");
        }

        AdmissionReview review;
        ReviewRequest request;
        try {
            review  = json.readValue(body == null ? new byte[0] : body, AdmissionReview.class);
            request = toReviewRequest(review);
        } catch (IOException e) {
            ReviewVerdict verdict = ReviewVerdict.deny(DECODE_FAILURE + e.getMessage());
            record(null, new Decision(verdict, "malformed"));
            return AdmissionOutcome.review(HttpStatus.BAD_REQUEST,
                    AdmissionReview.replyTo(AdmissionResponse.from(null, verdict)));
        }
        log.debug("Incoming AdmissionReview for {} on resource: {}", request.operation(), request.resource());

        Decision decision = decide(request);
        record(request, decision);
        return AdmissionOutcome.review(HttpStatus.OK,
                review.reply(AdmissionResponse.from(request.uid(), decision.verdict())));
    }

    // ------------------------------------------------------------------
    // Policy gates
    // ------------------------------------------------------------------

    Decision decide(ReviewRequest request) {
        if (admitAll) {
            log.warn("admitAll flag is set to true. Allowing Namespace admission review request to pass without validation.");
            return new Decision(ReviewVerdict.allow(), "admit-all");
        }

        if (!GroupVersionResource.NAMESPACES.equals(request.resource())) {
            return new Decision(
                    ReviewVerdict.deny("Incoming resource is not a Namespace: " + request.resource()),
                    "resource");
        }

        if (request.operation() != Operation.DELETE) {
            return new Decision(
                    ReviewVerdict.deny("Incoming operation is " + request.operation() + " on namespace "
                            + request.name() + ". Only DELETE is currently supported."),
                    "operation");
        }

        Optional<NamespaceRecord> namespace;
        try {
            namespace = namespaces.find(request.name());
        } catch (ClusterQueryException e) {
            return new Decision(
                    ReviewVerdict.deny("Error occurred while retrieving the namespace " + request.name()
                            + ": " + e.getMessage()),
                    "lookup-error");
        }
        if (namespace.isEmpty()) {
            // let the API server report the missing namespace itself
            log.debug("Namespace {} not found, let apiserver handle the error", request.name());
            return new Decision(ReviewVerdict.allow(), "not-found");
        }

        String bypass = namespace.get().annotation(ResourceTally.BYPASS_ANNOTATION_KEY);
        if (ResourceTally.BYPASS_ANNOTATION_VALUE.equals(bypass)) {
            log.info("Namespace {} has the bypass annotation set[{}:{}]. OK to DELETE.",
                    request.name(), ResourceTally.BYPASS_ANNOTATION_KEY, bypass);
            return new Decision(ReviewVerdict.allow(), "bypass");
        }

        ResourceTally tally = inventory.evaluate(request.name());
        if (!tally.isClear()) {
            return new Decision(ReviewVerdict.deny(tally.denialMessage()), "inventory");
        }
        log.info("Namespace {} does not contain any workload resources. OK to DELETE.", request.name());
        return new Decision(ReviewVerdict.allow(), "inventory");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ReviewRequest toReviewRequest(AdmissionReview review) throws IOException {
        // a literal "null" body decodes to a null review
        AdmissionRequest req = review == null ? null : review.request();
        if (req == null) {
            throw new IOException("the AdmissionReview has no request");
        }
        String username = req.userInfo() != null ? req.userInfo().username() : null;
        byte[] raw;
        try {
            raw = req.object() == null || req.object().isNull() ? new byte[0] : json.writeValueAsBytes(req.object());
        } catch (JsonProcessingException e) {
            throw new IOException("the request object cannot be re-encoded: " + e.getOriginalMessage(), e);
        }
        return new ReviewRequest(req.uid(), req.operation(), req.resource(),
                req.name(), req.namespace(), username, raw);
    }

    private void record(ReviewRequest request, Decision decision) {
        ReviewVerdict verdict = decision.verdict();
        log.info("Responding Allowed: {} for {} on Namespace: {} by user: {}",
                verdict.allowed(),
                request != null ? request.operation() : null,
                request != null ? request.name() : null,
                request != null ? request.requesterIdentity() : null);
        if (!verdict.allowed()) {
            log.error("Rejection reason: {}", verdict.reason());
        }
        meterRegistry.counter("nsguard.admission.verdicts",
                "allowed", Boolean.toString(verdict.allowed()),
                "gate", decision.gate()).increment();
    }
}
