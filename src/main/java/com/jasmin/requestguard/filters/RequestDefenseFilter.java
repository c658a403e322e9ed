package com.jasmin.requestguard.filters;

import com.jasmin.requestguard.constants.Constants;
import com.jasmin.requestguard.detectors.DetectorUtils;
import com.jasmin.requestguard.detectors.ratelimit.RateLimitDecision;
import com.jasmin.requestguard.detectors.ratelimit.RateLimiter;
import com.jasmin.requestguard.detectors.waf.AttackScanner;
import com.jasmin.requestguard.detectors.waf.ScanBudgetExceededException;
import com.jasmin.requestguard.detectors.waf.ViolationLedger;
import com.jasmin.requestguard.detectors.waf.WafProperties;
import com.jasmin.requestguard.extractors.CachedBodyHttpServletRequest;
import com.jasmin.requestguard.extractors.RequestContextResolver;
import com.jasmin.requestguard.extractors.RequestDataExtractor;
import com.jasmin.requestguard.models.RequestContext;
import com.jasmin.requestguard.models.RouteExemption;
import com.jasmin.requestguard.models.ScanResult;
import com.jasmin.requestguard.models.Severity;
import com.jasmin.requestguard.models.ViolationOutcome;
import com.jasmin.requestguard.services.BlockGate;
import com.jasmin.requestguard.services.ExemptionRegistry;
import com.jasmin.requestguard.services.SecurityAuditSink;
import com.jasmin.requestguard.store.StoreUnavailableException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The request defense pipeline. Stages run in a fixed order and the first rejection wins:
 * <ol>
 *     <li>block gate (IP with a live WAF block entry: 403)</li>
 *     <li>excluded path prefixes (pass)</li>
 *     <li>per-route exemption flags</li>
 *     <li>superuser / exempt client (pass)</li>
 *     <li>attack scanner (403, violation recorded)</li>
 *     <li>rate limiter (429)</li>
 * </ol>
 * Failures inside the scanner or the rate limiter are logged and the request is let through.
 * Exceptions raised by the downstream chain are never caught here.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestDefenseFilter extends OncePerRequestFilter {

    private final WafProperties wafCfg;
    private final RequestContextResolver contextResolver;
    private final BlockGate blockGate;
    private final ExemptionRegistry exemptions;
    private final RequestDataExtractor extractor;
    private final AttackScanner scanner;
    private final ViolationLedger ledger;
    private final RateLimiter rateLimiter;
    private final SecurityAuditSink auditSink;
    private final GuardResponseWriter responseWriter;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        RequestContext ctx = contextResolver.resolve(request);

        if (wafCfg.isEnabled() && blockGate.isBlocked(ctx.getClientIp())) {
            log.info("Rejecting {} {} from blocked IP {}", ctx.getMethod(), ctx.getPath(), ctx.getClientIp());
            responseWriter.writeBlocked(response);
            return;
        }

        if (exemptions.isExcludedPath(ctx.getPath())) {
            log.debug("Path {} is excluded from request defense", ctx.getPath());
            chain.doFilter(request, response);
            return;
        }

        RouteExemption route = exemptions.routeExemption(ctx.getPath());

        if (exemptions.isExemptClient(ctx)) {
            log.debug("Client {} ({}) is exempt from request defense", ctx.getIdentity(), ctx.getClientIp());
            chain.doFilter(request, response);
            return;
        }

        HttpServletRequest downstream = request;
        if (wafCfg.isEnabled() && !route.isWafExempt()) {
            if (!RequestDataExtractor.isMultipart(request.getContentType())) {
                downstream = new CachedBodyHttpServletRequest(request, wafCfg.getMaxBodyBytes());
            }
            if (rejectedAsAttack(downstream, ctx, response)) {
                return;
            }
        }

        if (!route.isRateLimitExempt()) {
            RateLimitDecision decision = evaluateRateLimit(ctx);
            if (decision.isRejected()) {
                responseWriter.writeRateLimited(response, decision);
                return;
            }
            if (decision.isCounted()) {
                responseWriter.applyRateLimitHeaders(response, decision);
            }
        }

        chain.doFilter(downstream, response);
    }

    private boolean rejectedAsAttack(HttpServletRequest request, RequestContext ctx, HttpServletResponse response)
            throws IOException {
        ScanResult result;
        try {
            result = scanner.scan(extractor.extract(request));
        } catch (ScanBudgetExceededException e) {
            log.warn("Attack scan of {} {} from {} aborted, allowing request: {}",
                    ctx.getMethod(), ctx.getPath(), ctx.getClientIp(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Attack scanner failed on {} {}, allowing request", ctx.getMethod(), ctx.getPath(), e);
            return false;
        }
        if (!result.isAttack()) {
            return false;
        }

        String fragment = DetectorUtils.abbreviate(result.getMatchedFragment(), DetectorUtils.MAX_FRAGMENT_LENGTH);
        log.warn("WAF detected {} from {} on {} {}: {}",
                result.getAttackType().getTag(), ctx.getClientIp(), ctx.getMethod(), ctx.getPath(), fragment);

        ViolationOutcome outcome;
        try {
            outcome = ledger.recordViolation(ctx.getClientIp());
        } catch (StoreUnavailableException e) {
            log.warn("Could not record violation for {}, rejecting without counting: {}", ctx.getClientIp(), e.getMessage());
            outcome = ViolationOutcome.unknown();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", ctx.getPath());
        details.put("method", ctx.getMethod());
        details.put("attack_type", result.getAttackType().getTag());
        details.put("pattern", fragment);
        details.put("violation_count", outcome.isRecorded() ? outcome.getCount() : null);
        details.put("ip_blocked", outcome.isNowBlocked());
        try {
            auditSink.recordSecurityEvent(Constants.SUSPICIOUS_ACTIVITY,
                    "WAF detected " + result.getAttackType().getTag() + " attack",
                    ctx.principalId(), ctx.getClientIp(), Severity.ERROR, details);
        } catch (RuntimeException e) {
            log.error("Audit sink failed for {} event: {}", Constants.SUSPICIOUS_ACTIVITY, e.getMessage());
        }

        String detail = Constants.WAF_DETAIL;
        if (outcome.isNowBlocked()) {
            detail = Constants.WAF_DETAIL + ". Your IP has been blocked for "
                    + DetectorUtils.describe(wafCfg.getBlockDuration()) + " due to repeated violations.";
        }
        responseWriter.writeAttack(response, detail);
        return true;
    }

    private RateLimitDecision evaluateRateLimit(RequestContext ctx) {
        try {
            return rateLimiter.evaluate(ctx);
        } catch (StoreUnavailableException e) {
            log.warn("Rate limiter could not reach the store, allowing {} {}: {}",
                    ctx.getMethod(), ctx.getPath(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Rate limiter failed on {} {}, allowing request", ctx.getMethod(), ctx.getPath(), e);
        }
        return RateLimitDecision.skipped();
    }
}
