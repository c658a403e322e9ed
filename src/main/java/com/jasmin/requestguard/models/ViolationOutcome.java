package com.jasmin.requestguard.models;

import lombok.Value;

/** Result of recording one WAF violation against a client IP. */
@Value
public class ViolationOutcome {

    /** Violation count after the increment, or -1 when the store could not be updated. */
    long count;

    /** True if this violation moved the IP into the blocked state. */
    boolean nowBlocked;

    public static ViolationOutcome unknown() {
        return new ViolationOutcome(-1, false);
    }

    public boolean isRecorded() {
        return count >= 0;
    }
}
