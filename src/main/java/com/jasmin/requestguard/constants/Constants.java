package com.jasmin.requestguard.constants;

public class Constants {
    // Audit event types
    public static final String SUSPICIOUS_ACTIVITY = "suspicious_activity";
    public static final String RATE_LIMIT_WARNING = "rate_limit_warning";
    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String RATE_LIMIT_BLOCKED = "rate_limit_blocked";
    public static final String IP_BLOCKED = "ip_blocked";
    public static final String IP_UNBLOCKED = "ip_unblocked";

    // Response bodies
    public static final String WAF_ERROR = "Request blocked";
    public static final String WAF_DETAIL = "Security violation detected";
    public static final String BLOCK_ERROR = "Access denied";
    public static final String BLOCK_DETAIL = "Your IP address has been temporarily blocked due to security violations";
    public static final String RATE_LIMIT_ERROR = "Rate limit exceeded";
    public static final String RATE_LIMIT_MESSAGE = "Rate limit exceeded. Please try again later.";
    public static final String RATE_LIMIT_BLOCKED_MESSAGE =
            "Too many requests. You have been temporarily blocked due to excessive requests.";

    // Rate limit headers
    public static final String X_RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String X_RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String X_RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String RATE_LIMIT_LIMIT = "RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "RateLimit-Reset";

    private Constants() {
    }
}
