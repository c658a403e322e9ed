package com.jasmin.requestguard.detectors.waf;

/**
 * Counts the character reads a regex matcher makes on a value and aborts the match once the
 * budget is spent. Backtracking re-reads characters, so the count bounds matcher work.
 */
final class BudgetedCharSequence implements CharSequence {

    private final String value;
    private final long budget;
    private final String patternName;
    private long reads;

    BudgetedCharSequence(String value, long budget, String patternName) {
        this.value = value;
        this.budget = budget;
        this.patternName = patternName;
    }

    @Override
    public char charAt(int index) {
        if (++reads > budget) {
            throw new ScanBudgetExceededException(patternName, value.length(), budget);
        }
        return value.charAt(index);
    }

    @Override
    public int length() {
        return value.length();
    }

    // only used to copy out the matched group
    @Override
    public CharSequence subSequence(int start, int end) {
        return value.substring(start, end);
    }

    @Override
    public String toString() {
        return value;
    }
}
