package com.jasmin.requestguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Structured record handed to the audit sink for every detected attack, block and
 * rate-limit escalation.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class SecurityEvent {
    private String eventType;
    private String description;

    // may be null for anonymous callers
    private String principal;
    private String clientIp;
    private Severity severity;

    private Map<String, Object> details;

    private Instant timestamp;
}
