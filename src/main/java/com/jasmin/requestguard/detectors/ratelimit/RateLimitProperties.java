package com.jasmin.requestguard.detectors.ratelimit;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "guard.rate-limit")
public class RateLimitProperties {

    /** Master switch for the rate limiter. */
    private boolean enabled = true;

    /** Quota used when no rule prefix matches ("N/period"). */
    private String defaultRule = "60/minute";

    /** Path prefix -> quota ("N/period"). The longest matching prefix wins. */
    @NotNull
    private Map<String, String> rules = new LinkedHashMap<>();

    /** If non-empty, only paths under these prefixes are rate limited. */
    @NotNull
    private List<String> limitedPaths = List.of();

    /** Client-wide block applied when a quota is exceeded. Zero disables blocking. */
    @NotNull
    private Duration blockDuration = Duration.ZERO;

    /** Share of the quota above which a warning event is emitted. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double warningRatio = 0.8;

    /** Send warning / exceeded / blocked events to the audit sink. */
    private boolean analyticsEnabled = true;
}
