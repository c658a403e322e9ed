package com.jasmin.requestguard.models;

/**
 * Sensitivity level of the WAF. Each tier activates every pattern of the tiers below it.
 */
public enum SecurityTier {
    LOW,
    MEDIUM,
    HIGH;

    /** True if patterns registered at {@code other} are active when this tier is selected. */
    public boolean includes(SecurityTier other) {
        return other != null && other.ordinal() <= this.ordinal();
    }
}
