package io.suitelog.core.render;

import io.suitelog.api.suite.SuiteStatus;

/**
 * Rendered detail for one suite that did not pass.
 *
 * @param key           sanitized suite name used to namespace outputs
 * @param suiteName     original suite name
 * @param status        final status
 * @param resultSummary end marker text, empty if the suite never ended
 * @param tests         one {@code name: Status} line per individual test, sorted by name
 * @param logDump       one line per log record observed while the suite was open
 */
public record SuiteDetail(
        String key,
        String suiteName,
        SuiteStatus status,
        String resultSummary,
        String tests,
        String logDump
) {}
