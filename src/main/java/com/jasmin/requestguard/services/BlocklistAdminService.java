package com.jasmin.requestguard.services;

import com.jasmin.requestguard.constants.Constants;
import com.jasmin.requestguard.detectors.DetectorUtils;
import com.jasmin.requestguard.detectors.waf.ViolationLedger;
import com.jasmin.requestguard.models.BlockStatus;
import com.jasmin.requestguard.models.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrative view of the WAF block list. Unlike the request pipeline this does not fail open:
 * store errors surface to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlocklistAdminService {

    private final ViolationLedger ledger;
    private final SecurityAuditSink auditSink;

    public BlockStatus status(String ip) {
        long ttl = ledger.blockTtl(ip).map(Duration::getSeconds).orElse(0L);
        return new BlockStatus(ip, ledger.isBlocked(ip), ttl, ledger.violationCount(ip));
    }

    public BlockStatus block(String ip, Duration duration, String reason, String actor) {
        if (ip == null || ip.isBlank()) {
            throw new IllegalArgumentException("ip is required");
        }
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("block duration must be positive");
        }
        ledger.block(ip, duration);
        log.info("Admin {} blocked IP {} for {}s: {}", actor, ip, duration.getSeconds(), DetectorUtils.nullSafe(reason));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("block_duration", duration.getSeconds());
        details.put("reason", reason);
        record(Constants.IP_BLOCKED, "IP blocked by administrator", Severity.WARNING, actor, ip, details);
        return status(ip);
    }

    /** Deletes the block entry and resets the violation counter. Works while the block is active. */
    public boolean unblock(String ip, String actor) {
        boolean removed = ledger.unblock(ip);
        log.info("Admin {} unblocked IP {} (state removed: {})", actor, ip, removed);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state_removed", removed);
        record(Constants.IP_UNBLOCKED, "IP unblocked by administrator", Severity.INFO, actor, ip, details);
        return removed;
    }

    private void record(String eventType, String description, Severity severity, String actor, String ip,
                        Map<String, Object> details) {
        try {
            auditSink.recordSecurityEvent(eventType, description, actor, ip, severity, details);
        } catch (RuntimeException e) {
            log.error("Audit sink failed for {} event: {}", eventType, e.getMessage());
        }
    }
}
