package com.jasmin.requestguard.detectors.ratelimit;

import lombok.Builder;
import lombok.Value;

/** What the rate limiter decided for one request, with the numbers the response headers need. */
@Value
@Builder
public class RateLimitDecision {

    public enum Outcome {
        /** Limiter disabled or path not limited: no headers. */
        SKIPPED,
        /** Counted and under the quota. */
        ALLOWED,
        /** Counted and over the quota: 429. */
        LIMITED,
        /** Client is in a rate-limit block: 429, nothing counted. */
        BLOCKED
    }

    private static final RateLimitDecision SKIPPED_DECISION = RateLimitDecision.builder().outcome(Outcome.SKIPPED).build();

    Outcome outcome;
    RateRule rule;
    long count;
    long remaining;

    // seconds until the current window ends
    long resetAfterSeconds;

    // epoch second at which the current window ends
    long resetEpochSecond;

    long retryAfterSeconds;

    public static RateLimitDecision skipped() {
        return SKIPPED_DECISION;
    }

    public boolean isRejected() {
        return outcome == Outcome.LIMITED || outcome == Outcome.BLOCKED;
    }

    public boolean isCounted() {
        return outcome == Outcome.ALLOWED || outcome == Outcome.LIMITED;
    }
}
