package com.jasmin.requestguard.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.requestguard.constants.Constants;
import com.jasmin.requestguard.detectors.ratelimit.RateLimitDecision;
import com.jasmin.requestguard.detectors.ratelimit.RateRule;
import com.jasmin.requestguard.models.GuardErrorResponse;
import com.jasmin.requestguard.models.RateLimitErrorResponse;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/** Renders the pipeline's 403 / 429 rejections and the rate-limit headers. */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuardResponseWriter {

    private final ObjectMapper objectMapper;

    public void writeAttack(HttpServletResponse response, String detail) throws IOException {
        write(response, HttpStatus.FORBIDDEN, new GuardErrorResponse(Constants.WAF_ERROR, detail));
    }

    public void writeBlocked(HttpServletResponse response) throws IOException {
        write(response, HttpStatus.FORBIDDEN, new GuardErrorResponse(Constants.BLOCK_ERROR, Constants.BLOCK_DETAIL));
    }

    public void writeRateLimited(HttpServletResponse response, RateLimitDecision decision) throws IOException {
        RateLimitErrorResponse body;
        if (decision.getOutcome() == RateLimitDecision.Outcome.BLOCKED) {
            body = RateLimitErrorResponse.builder()
                    .error(Constants.RATE_LIMIT_ERROR)
                    .message(Constants.RATE_LIMIT_BLOCKED_MESSAGE)
                    .build();
        } else {
            applyRateLimitHeaders(response, decision);
            RateRule rule = decision.getRule();
            body = RateLimitErrorResponse.builder()
                    .error(Constants.RATE_LIMIT_ERROR)
                    .message(Constants.RATE_LIMIT_MESSAGE)
                    .requestCount(decision.getCount())
                    .limit(rule.getLimit())
                    .period(rule.getPeriodName())
                    .build();
        }
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        write(response, HttpStatus.TOO_MANY_REQUESTS, body);
    }

    /** Quota headers for a counted request. Must be called before the response is committed. */
    public void applyRateLimitHeaders(HttpServletResponse response, RateLimitDecision decision) {
        RateRule rule = decision.getRule();
        if (rule == null) return;
        String limit = String.valueOf(rule.getLimit());
        String remaining = String.valueOf(decision.getRemaining());
        response.setHeader(Constants.X_RATE_LIMIT_LIMIT, limit);
        response.setHeader(Constants.X_RATE_LIMIT_REMAINING, remaining);
        response.setHeader(Constants.X_RATE_LIMIT_RESET, String.valueOf(decision.getResetEpochSecond()));
        response.setHeader(Constants.RATE_LIMIT_LIMIT, limit);
        response.setHeader(Constants.RATE_LIMIT_REMAINING, remaining);
        response.setHeader(Constants.RATE_LIMIT_RESET, String.valueOf(decision.getResetAfterSeconds()));
        if (decision.getCount() >= rule.getLimit()) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        }
    }

    private void write(HttpServletResponse response, HttpStatus status, Object body) throws IOException {
        if (response.isCommitted()) {
            log.warn("Response already committed, cannot write {} rejection", status.value());
            return;
        }
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }
}
