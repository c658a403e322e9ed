package com.jasmin.requestguard.store;

public enum TtlPolicy {
    /** TTL set when the counter is created; later increments keep the original expiry (fixed window). */
    ON_FIRST_WRITE,

    /** TTL reset on every increment (window measured from the last update). */
    ON_EVERY_WRITE
}
