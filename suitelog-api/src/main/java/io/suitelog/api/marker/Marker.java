package io.suitelog.api.marker;

import io.suitelog.api.suite.SuiteCounts;
import io.suitelog.api.suite.TestStatus;

/**
 * Lifecycle meaning of a single log line.
 * <p>
 * The sealed hierarchy keeps the set of markers closed so the aggregator
 * can handle every case explicitly.
 */
public sealed interface Marker {

    /**
     * A suite has started.
     */
    record SuiteStart(String name) implements Marker {}

    /**
     * A suite has finished. {@code resultText} is everything from the status word on,
     * e.g. {@code "Passed (3/3)!"}.
     */
    record SuiteEnd(String name, String resultText, SuiteCounts counts) implements Marker {}

    /**
     * One named assertion inside the open suite.
     */
    record ExpectResult(String testName, TestStatus status) implements Marker {}

    /**
     * Any line that carries no lifecycle information.
     */
    record Plain() implements Marker {

        public static final Plain INSTANCE = new Plain();
    }
}
