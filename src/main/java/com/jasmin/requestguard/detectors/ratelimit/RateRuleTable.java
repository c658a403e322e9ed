package com.jasmin.requestguard.detectors.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed quota table. Built once at startup; malformed entries are logged and replaced by the
 * default quota, a malformed default becomes {@code 60/minute}.
 */
@Slf4j
@Component
public class RateRuleTable {

    static final RateRule FALLBACK = RateRule.parse("60/minute");

    private final RateRule defaultRule;
    private final Map<String, RateRule> rules;

    public RateRuleTable(RateLimitProperties cfg) {
        this.defaultRule = parseDefault(cfg.getDefaultRule());

        Map<String, RateRule> parsed = new LinkedHashMap<>();
        cfg.getRules().forEach((prefix, text) -> {
            try {
                parsed.put(prefix, RateRule.parse(text));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid rate rule '{}' for prefix {}, using default {}: {}",
                        text, prefix, defaultRule.describe(), e.getMessage());
                parsed.put(prefix, defaultRule);
            }
        });
        this.rules = Collections.unmodifiableMap(parsed);
        log.info("Rate limiter loaded {} path rules, default {}", rules.size(), defaultRule.describe());
    }

    /** Rule of the longest configured prefix of {@code path}, the default rule if none matches. */
    public RateRule resolve(String path) {
        RateRule best = defaultRule;
        int bestLength = -1;
        if (path == null) return best;
        for (Map.Entry<String, RateRule> e : rules.entrySet()) {
            String prefix = e.getKey();
            if (path.startsWith(prefix) && prefix.length() > bestLength) {
                best = e.getValue();
                bestLength = prefix.length();
            }
        }
        return best;
    }

    public RateRule getDefaultRule() {
        return defaultRule;
    }

    public Map<String, RateRule> getRules() {
        return rules;
    }

    private static RateRule parseDefault(String text) {
        try {
            return RateRule.parse(text);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid default rate rule '{}', using {}: {}", text, FALLBACK.describe(), e.getMessage());
            return FALLBACK;
        }
    }
}
