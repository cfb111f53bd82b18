package com.nsguard.webhook.model;

/**
 * The allow/deny decision for one review request.
 * The reason is empty exactly when the request is allowed.
 */
public record ReviewVerdict(boolean allowed, String reason) {

    private static final ReviewVerdict ALLOWED = new ReviewVerdict(true, "");

    public ReviewVerdict {
        if (reason == null) reason = "";
        if (allowed && !reason.isEmpty()) {
            throw new IllegalArgumentException("An allowed verdict carries no reason");
        }
        if (!allowed && reason.isEmpty()) {
            throw new IllegalArgumentException("A denied verdict must carry a reason");
        }
    }

    public static ReviewVerdict allow() {
        return ALLOWED;
    }

    public static ReviewVerdict deny(String reason) {
        return new ReviewVerdict(false, reason);
    }
}
