package com.jasmin.requestguard.detectors.waf;

import com.jasmin.requestguard.models.SecurityTier;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "guard.waf")
public class WafProperties {

    /** Master switch for the attack scanner and the IP block gate. */
    private boolean enabled = true;

    /** Active pattern tier. */
    @NotNull
    private SecurityTier securityTier = SecurityTier.MEDIUM;

    /** Violations inside the window that put the IP on the blocklist. */
    @Min(1)
    private int maxViolations = 3;

    /** How long a blocked IP stays blocked. */
    @NotNull
    private Duration blockDuration = Duration.ofSeconds(600);

    /** Lifetime of the violation counter, measured from the most recent violation. */
    @NotNull
    private Duration violationWindow = Duration.ofHours(24);

    /** Header names never scanned; a trailing '*' matches by prefix. */
    @NotNull
    private List<String> excludedHeaders = List.of(
            "content-length", "content-type", "accept*", "host", "user-agent", "connection"
    );

    /** Bodies are cut to this many bytes before decoding and scanning. */
    @Min(0)
    private int maxBodyBytes = 64 * 1024;

    /**
     * Character reads one pattern may spend per character of the value it is matched against.
     * A pattern that needs more is aborted and the request is let through unscanned.
     */
    @Min(1)
    private int scanReadsPerChar = 64;
}
