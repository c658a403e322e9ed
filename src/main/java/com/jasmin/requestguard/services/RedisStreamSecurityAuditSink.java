package com.jasmin.requestguard.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.requestguard.detectors.DetectorUtils;
import com.jasmin.requestguard.models.SecurityEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes every event as an {@code [AUDIT]} log line and appends it to the {@code security:events}
 * stream. Failures of either step are logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisStreamSecurityAuditSink implements SecurityAuditSink {

    private static final ObjectMapper OM = new ObjectMapper();

    private final StringRedisTemplate redisTemplate;

    @Override
    public void recordSecurityEvent(SecurityEvent event) {
        if (event == null) return;
        Instant timestamp = event.getTimestamp() == null ? Instant.now() : event.getTimestamp();
        String details = toJson(event.getDetails());

        Map<String, Object> line = new LinkedHashMap<>();
        line.put("event_type", event.getEventType());
        line.put("severity", event.getSeverity() == null ? null : event.getSeverity().value());
        line.put("client_ip", event.getClientIp());
        line.put("principal", event.getPrincipal());
        line.put("description", event.getDescription());
        line.put("details", event.getDetails());
        line.put("timestamp", timestamp.toString());
        log.info("[AUDIT] {}", toJson(line));

        Map<String, String> data = new HashMap<>();
        data.put("event_type", DetectorUtils.getValueOrEmptyString(event.getEventType()));
        data.put("description", DetectorUtils.getValueOrEmptyString(event.getDescription()));
        data.put("principal", DetectorUtils.getValueOrEmptyString(event.getPrincipal()));
        data.put("client_ip", DetectorUtils.getValueOrEmptyString(event.getClientIp()));
        data.put("severity", event.getSeverity() == null ? "" : event.getSeverity().value());
        data.put("details", details);
        data.put("timestamp", timestamp.toString());

        try {
            redisTemplate.opsForStream().add(KeyManager.SECURITY_EVENTS_STREAM, data);
        } catch (Exception e) {
            log.error("Failed to append security event {} to stream: {}", event.getEventType(), e.getMessage());
        }
    }

    private static String toJson(Object value) {
        if (value == null) return "{}";
        try {
            return OM.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize audit payload", e);
            return String.valueOf(value);
        }
    }
}
