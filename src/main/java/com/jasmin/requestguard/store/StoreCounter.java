package com.jasmin.requestguard.store;

import lombok.Value;

import java.time.Duration;

/** Counter value after an atomic increment, with the key's remaining lifetime. */
@Value
public class StoreCounter {
    long count;
    Duration ttl;
}
