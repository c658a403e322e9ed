package com.jasmin.requestguard.models;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable list of compiled attack patterns for one {@link SecurityTier}.
 * Built once at startup and shared by every request thread.
 */
public final class PatternSet {

    private final SecurityTier tier;
    private final List<AttackPattern> patterns;

    public PatternSet(SecurityTier tier, List<AttackPattern> patterns) {
        this.tier = tier;
        this.patterns = List.copyOf(patterns);
    }

    public SecurityTier getTier() {
        return tier;
    }

    public List<AttackPattern> getPatterns() {
        return patterns;
    }

    public int size() {
        return patterns.size();
    }

    public List<String> signatures() {
        return patterns.stream().map(AttackPattern::signature).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "PatternSet{tier=" + tier + ", patterns=" + patterns.size() + "}";
    }
}
