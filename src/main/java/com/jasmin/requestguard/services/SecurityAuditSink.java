package com.jasmin.requestguard.services;

import com.jasmin.requestguard.models.SecurityEvent;
import com.jasmin.requestguard.models.Severity;

import java.time.Instant;
import java.util.Map;

/**
 * Receives one record per detected attack, block and rate-limit escalation.
 * Implementations are best-effort: they must never throw back into the request pipeline.
 */
public interface SecurityAuditSink {

    void recordSecurityEvent(SecurityEvent event);

    default void recordSecurityEvent(String eventType, String description, String principal,
                                     String clientIp, Severity severity, Map<String, Object> details) {
        recordSecurityEvent(SecurityEvent.builder()
                .eventType(eventType)
                .description(description)
                .principal(principal)
                .clientIp(clientIp)
                .severity(severity)
                .details(details)
                .timestamp(Instant.now())
                .build());
    }
}
