package io.suitelog.core.aggregate;

import io.suitelog.api.diagnostics.DiagnosticKind;
import io.suitelog.api.diagnostics.DiagnosticListener;
import io.suitelog.api.marker.Marker;
import io.suitelog.api.record.LogRecord;
import io.suitelog.api.suite.SuiteCounts;
import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteReport;
import io.suitelog.api.suite.SuiteStatus;
import io.suitelog.core.marker.MarkerClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Folds classified log records into per-suite outcomes.
 * <p>
 * The aggregator is a two-state automaton: {@link State.Idle} or
 * {@link State.InSuite} with exactly one open suite. Every suite is closed through
 * {@link #finalizeSuite}, whether by its own end marker, by an overlapping start, or by
 * {@link #finish()}. Structural problems are reported to the {@link DiagnosticListener}
 * and never abort aggregation.
 * <p>
 * Usage:
 * <pre>{@code
 * var aggregator = new SuiteAggregator(diagnostics);
 * batch.forEach(aggregator::accept);
 * SuiteReport report = aggregator.finish();
 * }</pre>
 */
public class SuiteAggregator {

    private static final Logger log = LoggerFactory.getLogger(SuiteAggregator.class);

    private static final Pattern FAILURE_WORD = Pattern.compile("\\b(fail|failed|failure|error)\\b",
            Pattern.CASE_INSENSITIVE);

    private sealed interface State {

        record Idle() implements State {}

        record InSuite(SuiteInProgress suite) implements State {}
    }

    private static final State IDLE = new State.Idle();

    private final DiagnosticListener diagnostics;
    private final Map<String, SuiteOutcome> suites = new LinkedHashMap<>();
    private State state = IDLE;
    private boolean finished;

    public SuiteAggregator(DiagnosticListener diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Run a fresh aggregator over a whole record sequence.
     */
    public static SuiteReport aggregate(Iterable<LogRecord> records, DiagnosticListener diagnostics) {
        var aggregator = new SuiteAggregator(diagnostics);
        records.forEach(aggregator::accept);
        return aggregator.finish();
    }

    /**
     * Feed the next record, in input order.
     */
    public void accept(LogRecord record) {
        if (finished) {
            throw new IllegalStateException("Aggregator already finished");
        }
        state = step(state, record, MarkerClassifier.classify(record));
    }

    /**
     * @return the name of the suite currently open, if any
     */
    public Optional<String> openSuiteName() {
        return state instanceof State.InSuite in ? Optional.of(in.suite().name()) : Optional.empty();
    }

    /**
     * Close any open suite as {@link SuiteStatus#INCOMPLETE} and return the report.
     * Calling it again returns the same report.
     */
    public SuiteReport finish() {
        if (!finished) {
            if (state instanceof State.InSuite in) {
                log.warn("Log ended while suite '{}' was still running", in.suite().name());
                finalizeSuite(in.suite(), SuiteStatus.INCOMPLETE, null, null);
            }
            state = IDLE;
            finished = true;
            log.info("Aggregated {} suites", suites.size());
        }
        return new SuiteReport(suites);
    }

    private State step(State current, LogRecord record, Marker marker) {
        if (current instanceof State.InSuite in) {
            return stepInSuite(in.suite(), record, marker);
        }
        return stepIdle(record, marker);
    }

    private State stepIdle(LogRecord record, Marker marker) {
        if (marker instanceof Marker.SuiteStart start) {
            return open(start.name(), record);
        }
        if (marker instanceof Marker.SuiteEnd end) {
            diagnostics.report(DiagnosticKind.STRUCTURAL_ANOMALY,
                    "Suite '" + end.name() + "' finished but was never started; ignored");
        } else if (marker instanceof Marker.ExpectResult result) {
            log.debug("Discarding result for '{}' outside of any suite", result.testName());
        }
        return IDLE;
    }

    private State stepInSuite(SuiteInProgress suite, LogRecord record, Marker marker) {
        if (marker instanceof Marker.SuiteStart start) {
            diagnostics.report(DiagnosticKind.STRUCTURAL_ANOMALY,
                    "Suite '" + start.name() + "' started while '" + suite.name()
                            + "' was still running; '" + suite.name() + "' marked incomplete");
            finalizeSuite(suite, SuiteStatus.INCOMPLETE, null, null);
            return open(start.name(), record);
        }

        suite.append(record);

        if (marker instanceof Marker.SuiteEnd end) {
            if (!end.name().equals(suite.name())) {
                diagnostics.report(DiagnosticKind.STRUCTURAL_ANOMALY,
                        "Suite '" + end.name() + "' finished while '" + suite.name() + "' was running; ignored");
                return new State.InSuite(suite);
            }
            SuiteStatus status = suite.anyTestFailed() || FAILURE_WORD.matcher(end.resultText()).find()
                    ? SuiteStatus.FAILED
                    : SuiteStatus.PASSED;
            finalizeSuite(suite, status, end.resultText(), end.counts());
            return IDLE;
        }
        if (marker instanceof Marker.ExpectResult result) {
            suite.recordTest(result.testName(), result.status());
        }
        return new State.InSuite(suite);
    }

    private State open(String name, LogRecord record) {
        if (suites.containsKey(name)) {
            diagnostics.report(DiagnosticKind.STRUCTURAL_ANOMALY,
                    "Suite '" + name + "' started again; the earlier result is replaced");
        }
        log.debug("Suite '{}' started", name);
        var suite = new SuiteInProgress(name);
        suite.append(record);
        return new State.InSuite(suite);
    }

    private void finalizeSuite(SuiteInProgress suite, SuiteStatus status, String resultSummary, SuiteCounts counts) {
        SuiteOutcome outcome = suite.finish(status, resultSummary, counts);
        suites.put(outcome.name(), outcome);
        log.debug("Suite '{}' finished as {} with {} log records", outcome.name(), status, suite.logCount());
    }
}
