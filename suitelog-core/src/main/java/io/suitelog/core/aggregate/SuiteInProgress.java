package io.suitelog.core.aggregate;

import io.suitelog.api.record.LogRecord;
import io.suitelog.api.suite.SuiteCounts;
import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteStatus;
import io.suitelog.api.suite.TestStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator for the one suite that is currently open.
 * Only the aggregator holds a reference to it.
 */
final class SuiteInProgress {

    private final String name;
    private final Map<String, TestStatus> individualTests = new LinkedHashMap<>();
    private final List<LogRecord> logs = new ArrayList<>();

    SuiteInProgress(String name) {
        this.name = name;
    }

    String name() {
        return name;
    }

    void append(LogRecord record) {
        logs.add(record);
    }

    void recordTest(String testName, TestStatus status) {
        individualTests.put(testName, status);
    }

    boolean anyTestFailed() {
        return individualTests.containsValue(TestStatus.FAILED);
    }

    int logCount() {
        return logs.size();
    }

    SuiteOutcome finish(SuiteStatus status, String resultSummary, SuiteCounts counts) {
        if (status == SuiteStatus.RUNNING) {
            throw new IllegalArgumentException("A finished suite cannot be RUNNING");
        }
        return new SuiteOutcome(name, status, resultSummary, counts, individualTests, logs);
    }
}
