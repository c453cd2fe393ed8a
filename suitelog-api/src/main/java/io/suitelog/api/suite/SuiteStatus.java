package io.suitelog.api.suite;

/**
 * Lifecycle status of a test suite.
 */
public enum SuiteStatus {

    /** Start marker seen, no end marker yet. Never present in a finished report. */
    RUNNING("Running"),
    PASSED("Passed"),
    FAILED("Failed"),
    /** The suite never received its end marker. */
    INCOMPLETE("Incomplete");

    private final String label;

    SuiteStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
