package com.jasmin.requestguard.config;

import com.jasmin.requestguard.detectors.ratelimit.RateLimiter;
import com.jasmin.requestguard.detectors.waf.AttackScanner;
import com.jasmin.requestguard.detectors.waf.ViolationLedger;
import com.jasmin.requestguard.detectors.waf.WafProperties;
import com.jasmin.requestguard.extractors.RequestContextResolver;
import com.jasmin.requestguard.extractors.RequestDataExtractor;
import com.jasmin.requestguard.filters.GuardResponseWriter;
import com.jasmin.requestguard.filters.RequestDefenseFilter;
import com.jasmin.requestguard.services.BlockGate;
import com.jasmin.requestguard.services.ExemptionRegistry;
import com.jasmin.requestguard.services.SecurityAuditSink;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
public class GuardFilterConfig {

    @Bean
    public RequestDefenseFilter requestDefenseFilter(WafProperties wafProperties,
                                                     RequestContextResolver contextResolver,
                                                     BlockGate blockGate,
                                                     ExemptionRegistry exemptions,
                                                     RequestDataExtractor extractor,
                                                     AttackScanner scanner,
                                                     ViolationLedger ledger,
                                                     RateLimiter rateLimiter,
                                                     SecurityAuditSink auditSink,
                                                     GuardResponseWriter responseWriter) {
        return new RequestDefenseFilter(wafProperties, contextResolver, blockGate, exemptions, extractor,
                scanner, ledger, rateLimiter, auditSink, responseWriter);
    }

    /** Runs ahead of every application filter so rejected requests never reach them. */
    @Bean
    public FilterRegistrationBean<RequestDefenseFilter> requestDefenseFilterRegistration(RequestDefenseFilter filter) {
        FilterRegistrationBean<RequestDefenseFilter> registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
        registration.setName("requestDefenseFilter");
        return registration;
    }
}
