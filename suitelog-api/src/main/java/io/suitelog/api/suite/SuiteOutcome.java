package io.suitelog.api.suite;

import io.suitelog.api.record.LogRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final state of one test suite.
 *
 * @param name            suite name, unique within a report
 * @param status          final status
 * @param resultSummary   text captured from the end marker, null if the suite never ended
 * @param counts          passed/total from the end marker, null if the suite never ended
 * @param individualTests sub-test results in first-recorded order
 * @param logs            every record seen while the suite was open, in input order
 */
public record SuiteOutcome(
        String name,
        SuiteStatus status,
        String resultSummary,
        SuiteCounts counts,
        Map<String, TestStatus> individualTests,
        List<LogRecord> logs
) {

    public SuiteOutcome {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        individualTests = Collections.unmodifiableMap(new LinkedHashMap<>(individualTests));
        logs = List.copyOf(logs);
    }

    public boolean passed() {
        return status == SuiteStatus.PASSED;
    }

    /**
     * @return names of the individual tests that failed, in recorded order
     */
    public List<String> failedTests() {
        return individualTests.entrySet().stream()
                .filter(e -> e.getValue() == TestStatus.FAILED)
                .map(Map.Entry::getKey)
                .toList();
    }
}
