package io.suitelog.api.suite;

/**
 * Passed/total counts reported by a suite-end marker.
 */
public record SuiteCounts(int passed, int total) {

    public SuiteCounts {
        if (passed < 0 || total < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
    }

    @Override
    public String toString() {
        return passed + "/" + total;
    }
}
