package com.jasmin.requestguard.models;

import java.util.Objects;

/**
 * Outcome of a scan: either clean or the first attack found, with the matched fragment.
 */
public final class ScanResult {

    private static final ScanResult CLEAN = new ScanResult(null, null);

    private final AttackType attackType;
    private final String matchedFragment;

    private ScanResult(AttackType attackType, String matchedFragment) {
        this.attackType = attackType;
        this.matchedFragment = matchedFragment;
    }

    public static ScanResult clean() {
        return CLEAN;
    }

    public static ScanResult attack(AttackType attackType, String matchedFragment) {
        return new ScanResult(Objects.requireNonNull(attackType), matchedFragment);
    }

    public boolean isAttack() {
        return attackType != null;
    }

    public AttackType getAttackType() {
        return attackType;
    }

    public String getMatchedFragment() {
        return matchedFragment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanResult)) return false;
        ScanResult that = (ScanResult) o;
        return attackType == that.attackType && Objects.equals(matchedFragment, that.matchedFragment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attackType, matchedFragment);
    }

    @Override
    public String toString() {
        return isAttack() ? "Attack{" + attackType.getTag() + ", '" + matchedFragment + "'}" : "Clean";
    }
}
