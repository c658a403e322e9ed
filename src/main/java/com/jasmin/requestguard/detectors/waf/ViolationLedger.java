package com.jasmin.requestguard.detectors.waf;

import com.jasmin.requestguard.models.ViolationOutcome;
import com.jasmin.requestguard.services.KeyManager;
import com.jasmin.requestguard.store.KeyValueStore;
import com.jasmin.requestguard.store.StoreCounter;
import com.jasmin.requestguard.store.TtlPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-IP violation counter and block entry, both held in the shared store.
 * <p>
 * Every violation refreshes the counter TTL to the full {@code violation-window}, so the window is
 * measured from the most recent violation rather than from the first one. Once the count reaches
 * {@code max-violations} a block entry is written with TTL {@code block-duration}; the counter is
 * left in place, so an IP that reoffends after its block expires is blocked again on its next
 * violation. All methods throw {@link com.jasmin.requestguard.store.StoreUnavailableException}
 * when the store is down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ViolationLedger {

    private static final String BLOCKED = "1";

    private final KeyValueStore store;
    private final WafProperties cfg;

    public ViolationOutcome recordViolation(String ip) {
        StoreCounter counter = store.increment(
                KeyManager.violationKey(ip), cfg.getViolationWindow(), TtlPolicy.ON_EVERY_WRITE);

        long count = counter.getCount();
        if (count >= cfg.getMaxViolations()) {
            store.set(KeyManager.ipBlockKey(ip), BLOCKED, cfg.getBlockDuration());
            log.warn("WAF blocked IP {} for {}s after {} violations in the violation window",
                    ip, cfg.getBlockDuration().getSeconds(), count);
            return new ViolationOutcome(count, true);
        }
        return new ViolationOutcome(count, false);
    }

    public boolean isBlocked(String ip) {
        return store.exists(KeyManager.ipBlockKey(ip));
    }

    public Optional<Duration> blockTtl(String ip) {
        return store.ttl(KeyManager.ipBlockKey(ip));
    }

    public long violationCount(String ip) {
        return store.get(KeyManager.violationKey(ip))
                .map(ViolationLedger::parseCount)
                .orElse(0L);
    }

    public void block(String ip, Duration duration) {
        store.set(KeyManager.ipBlockKey(ip), BLOCKED, duration);
    }

    /** Removes the block entry and resets the violation counter. True if anything was removed. */
    public boolean unblock(String ip) {
        boolean blockRemoved = store.delete(KeyManager.ipBlockKey(ip));
        boolean countRemoved = store.delete(KeyManager.violationKey(ip));
        return blockRemoved || countRemoved;
    }

    private static long parseCount(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric violation counter value '{}'", value);
            return 0L;
        }
    }
}
