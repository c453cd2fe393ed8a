package io.suitelog.api.suite;

/**
 * Result of an individual test inside a suite.
 */
public enum TestStatus {

    PASSED("Passed"),
    FAILED("Failed");

    private final String label;

    TestStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
