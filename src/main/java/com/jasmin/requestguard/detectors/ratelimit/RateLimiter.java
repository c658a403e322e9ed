package com.jasmin.requestguard.detectors.ratelimit;

import com.jasmin.requestguard.constants.Constants;
import com.jasmin.requestguard.detectors.DetectorUtils;
import com.jasmin.requestguard.extractors.RequestContextResolver;
import com.jasmin.requestguard.models.RequestContext;
import com.jasmin.requestguard.models.Severity;
import com.jasmin.requestguard.services.ExemptionRegistry;
import com.jasmin.requestguard.services.KeyManager;
import com.jasmin.requestguard.services.SecurityAuditSink;
import com.jasmin.requestguard.store.KeyValueStore;
import com.jasmin.requestguard.store.StoreCounter;
import com.jasmin.requestguard.store.StoreUnavailableException;
import com.jasmin.requestguard.store.TtlPolicy;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-window quota per {@code (client identity, normalized path)}.
 * <p>
 * The window counter is created with a TTL of one rule period on its first increment and is not
 * touched by later increments, so the window resets when the key expires. When
 * {@code guard.rate-limit.block-duration} is positive, exceeding a quota also writes a client-wide
 * block entry that rejects every limited path until it expires.
 * <p>
 * {@link #evaluate(RequestContext)} lets {@link StoreUnavailableException} through; the caller fails
 * open. Exemptions and excluded paths are the caller's job there, {@link #tryAcquireAction} checks
 * them itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiter {

    private static final String BLOCKED = "1";
    private static final long DEFAULT_BLOCK_RETRY_SECONDS = 300;

    private final KeyValueStore store;
    private final RateLimitProperties cfg;
    private final RateRuleTable rules;
    private final ExemptionRegistry exemptions;
    private final RequestContextResolver contextResolver;
    private final SecurityAuditSink auditSink;
    private final Clock clock;

    public RateLimitDecision evaluate(RequestContext ctx) {
        if (!cfg.isEnabled()) {
            return RateLimitDecision.skipped();
        }
        if (!cfg.getLimitedPaths().isEmpty() && !DetectorUtils.startsWithAny(ctx.getPath(), cfg.getLimitedPaths())) {
            log.debug("Path {} is outside the rate limited prefixes", ctx.getPath());
            return RateLimitDecision.skipped();
        }

        String blockKey = KeyManager.rateBlockKey(ctx.getIdentity());
        if (isBlockingEnabled() && store.exists(blockKey)) {
            long retryAfter = store.ttl(blockKey)
                    .map(DetectorUtils::ceilSeconds)
                    .orElse(DEFAULT_BLOCK_RETRY_SECONDS);
            log.info("Rejecting {} {} from rate-limit blocked client {}", ctx.getMethod(), ctx.getPath(), ctx.getIdentity());
            audit(Constants.RATE_LIMIT_BLOCKED, "Request from rate-limit blocked client", Severity.ERROR, ctx,
                    baseDetails(ctx));
            return RateLimitDecision.builder()
                    .outcome(RateLimitDecision.Outcome.BLOCKED)
                    .retryAfterSeconds(retryAfter)
                    .build();
        }

        RateRule rule = rules.resolve(ctx.getPath());
        StoreCounter counter = store.increment(
                KeyManager.rateWindowKey(ctx.getIdentity(), PathNormalizer.normalize(ctx.getPath())),
                Duration.ofSeconds(rule.getPeriodSeconds()),
                TtlPolicy.ON_FIRST_WRITE);

        long count = counter.getCount();
        long resetAfter = Math.min(DetectorUtils.ceilSeconds(counter.getTtl()), rule.getPeriodSeconds());
        RateLimitDecision.RateLimitDecisionBuilder decision = RateLimitDecision.builder()
                .rule(rule)
                .count(count)
                .remaining(Math.max(0, rule.getLimit() - count))
                .resetAfterSeconds(resetAfter)
                .resetEpochSecond(clock.instant().getEpochSecond() + resetAfter)
                .retryAfterSeconds(resetAfter);

        if (count > rule.getLimit()) {
            if (isBlockingEnabled()) {
                store.set(blockKey, BLOCKED, cfg.getBlockDuration());
                log.warn("Rate limit block on client {} for {}s after {} requests to {} (limit {})",
                        ctx.getIdentity(), cfg.getBlockDuration().getSeconds(), count, ctx.getPath(), rule.describe());
            } else {
                log.warn("Rate limit exceeded by client {}: {} requests to {} (limit {})",
                        ctx.getIdentity(), count, ctx.getPath(), rule.describe());
            }
            audit(Constants.RATE_LIMIT_EXCEEDED, "Rate limit exceeded", Severity.WARNING, ctx,
                    countDetails(ctx, count, rule));
            return decision.outcome(RateLimitDecision.Outcome.LIMITED).build();
        }

        if (count > rule.getLimit() * cfg.getWarningRatio()) {
            audit(Constants.RATE_LIMIT_WARNING, "Approaching rate limit", Severity.INFO, ctx,
                    countDetails(ctx, count, rule));
        }
        return decision.outcome(RateLimitDecision.Outcome.ALLOWED).build();
    }

    /**
     * Counts one {@code action} (e.g. {@code model_upload}) for the caller of {@code request}.
     * Superusers and exempt clients always pass, as does every call while the store is down.
     *
     * @param rule quota to apply, {@code null} for the default quota
     * @return false when the action quota is used up
     */
    public boolean tryAcquireAction(HttpServletRequest request, String action, RateRule rule) {
        RequestContext ctx = contextResolver.resolve(request);
        if (exemptions.isExemptClient(ctx)) {
            return true;
        }
        RateRule applied = Optional.ofNullable(rule).orElse(rules.getDefaultRule());
        try {
            StoreCounter counter = store.increment(
                    KeyManager.actionWindowKey(ctx.getIdentity(), action),
                    Duration.ofSeconds(applied.getPeriodSeconds()),
                    TtlPolicy.ON_FIRST_WRITE);
            return counter.getCount() <= applied.getLimit();
        } catch (StoreUnavailableException e) {
            log.warn("Action quota {} could not reach the store, allowing client {}: {}",
                    action, ctx.getIdentity(), e.getMessage());
            return true;
        }
    }

    private boolean isBlockingEnabled() {
        Duration d = cfg.getBlockDuration();
        return d != null && !d.isZero() && !d.isNegative();
    }

    private void audit(String eventType, String description, Severity severity, RequestContext ctx,
                       Map<String, Object> details) {
        if (!cfg.isAnalyticsEnabled()) return;
        try {
            auditSink.recordSecurityEvent(eventType, description, ctx.principalId(), ctx.getClientIp(), severity, details);
        } catch (RuntimeException e) {
            log.error("Audit sink failed for {} event: {}", eventType, e.getMessage());
        }
    }

    private static Map<String, Object> baseDetails(RequestContext ctx) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", ctx.getPath());
        details.put("method", ctx.getMethod());
        details.put("client_id", ctx.getIdentity().key());
        return details;
    }

    private static Map<String, Object> countDetails(RequestContext ctx, long count, RateRule rule) {
        Map<String, Object> details = baseDetails(ctx);
        details.put("request_count", count);
        details.put("limit", rule.describe());
        return details;
    }
}
