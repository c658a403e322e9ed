package com.jasmin.requestguard.detectors.waf;

import com.jasmin.requestguard.models.AttackPattern;
import com.jasmin.requestguard.models.PatternSet;
import com.jasmin.requestguard.models.ScanResult;
import com.jasmin.requestguard.models.ScanTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Runs a {@link ScanTarget} against a {@link PatternSet}: headers first, then query values, then
 * the body. Stops at the first match. Holds no mutable state.
 * <p>
 * Every pattern gets a budget of character reads proportional to the length of the value it is
 * matched against. A pattern that backtracks past its budget aborts the whole scan with
 * {@link ScanBudgetExceededException}.
 */
@Service
@RequiredArgsConstructor
public class AttackScanner {

    /** Reads granted to any match regardless of value length. */
    static final long BASE_BUDGET = 4096;

    private final PatternSet activePatterns;
    private final WafProperties wafCfg;

    /** Scans against the pattern set of the configured tier. */
    public ScanResult scan(ScanTarget target) {
        return scan(target, activePatterns);
    }

    /**
     * @throws ScanBudgetExceededException when a pattern exhausts its read budget on some value
     */
    public ScanResult scan(ScanTarget target, PatternSet patterns) {
        if (target == null || patterns == null) {
            return ScanResult.clean();
        }

        ScanResult result = scanMultiValued(target.getHeaders(), patterns);
        if (result.isAttack()) return result;

        result = scanMultiValued(target.getQueryParams(), patterns);
        if (result.isAttack()) return result;

        if (target.getStructuredBody() != null) {
            for (Object leaf : target.getStructuredBody().values()) {
                // numbers, booleans and nulls carry no payload
                if (leaf instanceof String s) {
                    result = check(s, patterns);
                    if (result.isAttack()) return result;
                }
            }
        } else if (target.getRawBody() != null) {
            return check(target.getRawBody(), patterns);
        }

        return ScanResult.clean();
    }

    private ScanResult scanMultiValued(Map<String, List<String>> values, PatternSet patterns) {
        if (values == null) {
            return ScanResult.clean();
        }
        for (List<String> list : values.values()) {
            if (list == null) continue;
            for (String value : list) {
                ScanResult result = check(value, patterns);
                if (result.isAttack()) return result;
            }
        }
        return ScanResult.clean();
    }

    private ScanResult check(String value, PatternSet patterns) {
        if (value == null || value.isEmpty()) {
            return ScanResult.clean();
        }
        long budget = BASE_BUDGET + (long) value.length() * wafCfg.getScanReadsPerChar();
        for (AttackPattern pattern : patterns.getPatterns()) {
            Matcher m = pattern.getRegex().matcher(
                    new BudgetedCharSequence(value, budget, pattern.getType().getTag() + " " + pattern.getRegex().pattern()));
            if (m.find()) {
                return ScanResult.attack(pattern.getType(), m.group());
            }
        }
        return ScanResult.clean();
    }
}
