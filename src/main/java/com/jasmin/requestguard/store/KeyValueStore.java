package com.jasmin.requestguard.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared, TTL-capable key/value store used for every cross-process counter and block entry.
 * Implementations throw {@link StoreUnavailableException} when the backend cannot be reached
 * or a round-trip exceeds its timeout; callers decide how to fail open.
 */
public interface KeyValueStore {

    /**
     * Atomically increments {@code key} and applies {@code ttl} according to {@code policy}.
     * A missing or expired key starts again at 1.
     */
    StoreCounter increment(String key, Duration ttl, TtlPolicy policy);

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /** Remaining lifetime of {@code key}; empty if the key is missing or never expires. */
    Optional<Duration> ttl(String key);

    boolean delete(String key);

    default boolean exists(String key) {
        return get(key).isPresent();
    }
}
