package com.jasmin.requestguard.detectors.waf;

/**
 * A pattern needed more character reads than the scan budget allows for the value being matched.
 * The value is left unclassified.
 */
public class ScanBudgetExceededException extends RuntimeException {

    private final String patternName;
    private final int valueLength;

    public ScanBudgetExceededException(String patternName, int valueLength, long budget) {
        super("Pattern " + patternName + " exceeded " + budget + " character reads on a value of length " + valueLength);
        this.patternName = patternName;
        this.valueLength = valueLength;
    }

    public String getPatternName() {
        return patternName;
    }

    public int getValueLength() {
        return valueLength;
    }
}
