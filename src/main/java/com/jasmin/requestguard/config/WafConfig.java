package com.jasmin.requestguard.config;

import com.jasmin.requestguard.detectors.waf.PatternCatalog;
import com.jasmin.requestguard.detectors.waf.WafProperties;
import com.jasmin.requestguard.models.PatternSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class WafConfig {

    /** Pattern set of the configured tier, compiled once and shared by all request threads. */
    @Bean
    public PatternSet activePatternSet(WafProperties props) {
        PatternSet patterns = PatternCatalog.buildPatterns(props.getSecurityTier());
        log.info("WAF initialized - enabled: {}, security tier: {}, patterns: {}, max violations: {}, block duration: {}s",
                props.isEnabled(), props.getSecurityTier(), patterns.size(),
                props.getMaxViolations(), props.getBlockDuration().getSeconds());
        return patterns;
    }
}
