package com.jasmin.requestguard.detectors.ratelimit;

import lombok.Value;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A quota: {@code limit} requests per {@code periodSeconds}.
 * Text form is {@code N/period}, where period is a unit name ({@code second}, {@code minute},
 * {@code hour}, {@code day} and their short forms) optionally prefixed by a multiplier
 * ({@code 3/60s}). An unknown unit name means minute.
 */
@Value
public class RateRule {

    private static final Pattern PERIOD = Pattern.compile("^(\\d*)\\s*([a-z]*)$");

    int limit;
    long periodSeconds;
    String periodName;

    public static RateRule of(int limit, long periodSeconds) {
        if (limit <= 0 || periodSeconds <= 0) {
            throw new IllegalArgumentException("limit and period must be positive");
        }
        return new RateRule(limit, periodSeconds, periodSeconds + " seconds");
    }

    /**
     * @throws IllegalArgumentException when the text has no {@code /}, the count is not a positive
     *                                  integer or the period is zero or
     *                                  does not fit in a {@code long} number of seconds
     */
    public static RateRule parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("rate rule is null");
        }
        int slash = text.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("rate rule '" + text + "' is not of the form N/period");
        }

        int limit;
        try {
            limit = Integer.parseInt(text.substring(0, slash).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("rate rule '" + text + "' has a non-numeric count", e);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("rate rule '" + text + "' has a non-positive count");
        }

        String period = text.substring(slash + 1).trim().toLowerCase(Locale.ROOT);
        Matcher m = PERIOD.matcher(period);
        long multiplier = 1;
        String unit = period;
        if (m.matches()) {
            if (!m.group(1).isEmpty()) {
                try {
                    multiplier = Long.parseLong(m.group(1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("rate rule '" + text + "' has an oversized period", e);
                }
                if (multiplier <= 0) {
                    throw new IllegalArgumentException("rate rule '" + text + "' has a zero period");
                }
            }
            unit = m.group(2);
        }

        long unitSeconds;
        String unitName;
        switch (unit) {
            case "s", "sec", "second", "seconds" -> {
                unitSeconds = 1;
                unitName = "second";
            }
            case "h", "hour", "hours" -> {
                unitSeconds = 3600;
                unitName = "hour";
            }
            case "d", "day", "days" -> {
                unitSeconds = 86400;
                unitName = "day";
            }
            default -> {
                unitSeconds = 60;
                unitName = "minute";
            }
        }

        long periodSeconds;
        try {
            periodSeconds = Math.multiplyExact(unitSeconds, multiplier);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("rate rule '" + text + "' has an oversized period", e);
        }
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("rate rule '" + text + "' has a non-positive period");
        }

        String name = multiplier == 1 ? unitName : multiplier + " " + unitName + "s";
        return new RateRule(limit, periodSeconds, name);
    }

    /** {@code 30/minute}, as used in audit records. */
    public String describe() {
        return limit + "/" + periodName;
    }
}
