package com.jasmin.requestguard.services;

import com.jasmin.requestguard.detectors.waf.ViolationLedger;
import com.jasmin.requestguard.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * First stage of the pipeline: rejects every request from an IP with a live block entry.
 * Store failures are logged and treated as "not blocked".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockGate {

    private final ViolationLedger ledger;

    public boolean isBlocked(String ip) {
        try {
            return ledger.isBlocked(ip);
        } catch (StoreUnavailableException e) {
            log.warn("Block gate could not reach the store, allowing request from {}: {}", ip, e.getMessage());
            return false;
        }
    }
}
