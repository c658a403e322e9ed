package com.jasmin.requestguard.models;

import lombok.Value;

import java.util.regex.Pattern;

@Value
public class AttackPattern {
    AttackType type;
    SecurityTier tier;
    Pattern regex;

    /** Stable identity of the pattern, {@link Pattern} itself has no value equality. */
    public String signature() {
        return type.getTag() + "|" + regex.flags() + "|" + regex.pattern();
    }
}
