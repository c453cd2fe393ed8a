package io.suitelog.core.report;

import io.suitelog.api.report.ReportGenerationException;
import io.suitelog.api.report.ReportGenerator;
import io.suitelog.api.suite.SuiteOutcome;
import io.suitelog.api.suite.SuiteReport;
import io.suitelog.api.suite.SuiteStatus;
import io.suitelog.api.suite.TestStatus;
import io.suitelog.core.render.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generates a standalone HTML report of the analysed suites.
 * <p>
 * The report includes:
 * <ul>
 *   <li>Overall verdict and suite counts by status</li>
 *   <li>Per-suite table with status badges and end marker text</li>
 *   <li>Individual test results of every suite</li>
 *   <li>Captured console logs of each suite that did not pass</li>
 * </ul>
 * <p>
 * The output is a single self-contained HTML file with inline CSS.
 */
public class HtmlReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(HtmlReportGenerator.class);
    private static final DateTimeFormatter DATETIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public HtmlReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    public HtmlReportGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Path generate(SuiteReport report, boolean success, Path outputPath) {
        String html = buildHtml(report, success);
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, html);
            log.info("Report generated: {}", outputPath.toAbsolutePath());
            return outputPath;
        } catch (IOException e) {
            throw new ReportGenerationException("Failed to write report to " + outputPath, e);
        }
    }

    @Override
    public String format() {
        return "HTML";
    }

    private String buildHtml(SuiteReport report, boolean success) {
        String generatedAt = clock.instant().atZone(ZoneId.systemDefault()).format(DATETIME_FMT);

        StringBuilder sb = new StringBuilder();
        sb.append(htmlHead());
        sb.append("<body><div class=\"wrap\">\n");
        sb.append(sectionHeader(generatedAt, success));
        sb.append(summaryCards(report));
        sb.append(suiteTable(report));
        for (SuiteOutcome suite : report.suites()) {
            sb.append(suiteSection(suite));
        }
        sb.append("</div></body>\n");
        sb.append("</html>");
        return sb.toString();
    }

    // ─── HTML sections ───

    private String htmlHead() {
        return """
                <!DOCTYPE html>
                <html lang="en">
                <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1.0">
                <title>Suitelog Test Report</title>
                <style>
                :root {
                    --bg: #0f1117; --surface: #161b22; --border: #2a3343;
                    --text: #e1e4e8; --muted: #7a8ba5; --dim: #4a5b73;
                    --blue: #3b8bff; --green: #34d399; --red: #ef4444; --amber: #f59e0b;
                }
                * { margin: 0; padding: 0; box-sizing: border-box; }
                body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; background: var(--bg); color: var(--text); }
                .wrap { max-width: 1200px; margin: 0 auto; padding: 40px 24px; }
                .header { margin-bottom: 40px; }
                .header h1 { font-size: 28px; font-weight: 800; margin-bottom: 8px; }
                .header h1 span { color: var(--blue); }
                .header .meta { font-size: 13px; color: var(--muted); display: flex; gap: 24px; flex-wrap: wrap; }
                .cards { display: grid; grid-template-columns: repeat(auto-fit, minmax(160px, 1fr)); gap: 12px; margin-bottom: 40px; }
                .card { background: var(--surface); border: 1px solid var(--border); border-radius: 10px; padding: 20px; }
                .card-label { font-size: 11px; color: var(--dim); text-transform: uppercase; letter-spacing: 1px; margin-bottom: 6px; }
                .card-val { font-size: 26px; font-weight: 800; font-variant-numeric: tabular-nums; }
                .card-val.blue { color: var(--blue); } .card-val.green { color: var(--green); }
                .card-val.red { color: var(--red); } .card-val.amber { color: var(--amber); }
                .section { margin-bottom: 40px; }
                .section h2 { font-size: 18px; font-weight: 700; margin-bottom: 16px; color: var(--muted); }
                table { width: 100%; border-collapse: collapse; background: var(--surface); border: 1px solid var(--border); border-radius: 10px; overflow: hidden; }
                th { text-align: left; padding: 12px 16px; font-size: 11px; font-weight: 700; text-transform: uppercase; letter-spacing: 0.8px; color: var(--dim); background: rgba(0,0,0,0.3); border-bottom: 1px solid var(--border); }
                td { padding: 12px 16px; font-size: 14px; border-bottom: 1px solid rgba(42,51,67,0.5); }
                tr:last-child td { border-bottom: none; }
                .suite-name { font-weight: 600; color: var(--blue); }
                pre.logs { background: var(--surface); border: 1px solid var(--border); border-radius: 10px; padding: 16px; font-size: 12px; overflow-x: auto; white-space: pre-wrap; }
                .badge { display: inline-block; padding: 2px 8px; border-radius: 4px; font-size: 11px; font-weight: 700; }
                .badge-pass { background: rgba(52,211,153,0.15); color: var(--green); }
                .badge-fail { background: rgba(239,68,68,0.15); color: var(--red); }
                .badge-incomplete { background: rgba(245,158,11,0.15); color: var(--amber); }
                @media print { body { background: #fff; color: #111; } .card, table, pre.logs { border-color: #ddd; } }
                </style>
                </head>
                """;
    }

    private String sectionHeader(String generatedAt, boolean success) {
        return """
                <div class="header">
                    <h1><span>Suitelog</span> Test Report</h1>
                    <div class="meta">
                        <span>Generated: %s</span>
                        <span>Verdict: %s</span>
                    </div>
                </div>
                """.formatted(generatedAt, success ? badge(SuiteStatus.PASSED) : badge(SuiteStatus.FAILED));
    }

    private String summaryCards(SuiteReport report) {
        return """
                <div class="cards">
                    <div class="card"><div class="card-label">Suites</div><div class="card-val blue">%d</div></div>
                    <div class="card"><div class="card-label">Passed</div><div class="card-val green">%d</div></div>
                    <div class="card"><div class="card-label">Failed</div><div class="card-val red">%d</div></div>
                    <div class="card"><div class="card-label">Incomplete</div><div class="card-val amber">%d</div></div>
                </div>
                """.formatted(
                report.size(),
                report.count(SuiteStatus.PASSED),
                report.count(SuiteStatus.FAILED),
                report.count(SuiteStatus.INCOMPLETE));
    }

    private String suiteTable(SuiteReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("""
                <div class="section">
                <h2>Suites</h2>
                <table>
                <thead><tr>
                    <th>Suite</th><th>Tests</th><th>Failed</th><th>Result</th><th>Status</th>
                </tr></thead>
                <tbody>
                """);

        if (report.isEmpty()) {
            sb.append("<tr><td colspan=\"5\">").append(escapeHtml(ReportRenderer.NO_RESULTS)).append("</td></tr>\n");
        }
        for (SuiteOutcome suite : report.suites()) {
            sb.append("""
                    <tr>
                        <td class="suite-name">%s</td>
                        <td>%d</td>
                        <td>%d</td>
                        <td>%s</td>
                        <td>%s</td>
                    </tr>
                    """.formatted(
                    escapeHtml(suite.name()),
                    suite.individualTests().size(),
                    suite.failedTests().size(),
                    escapeHtml(suite.resultSummary() == null ? "" : suite.resultSummary()),
                    badge(suite.status())));
        }

        sb.append("</tbody></table></div>\n");
        return sb.toString();
    }

    private String suiteSection(SuiteOutcome suite) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"section\" id=\"suite-").append(ReportRenderer.sanitizeKey(suite.name())).append("\">\n");
        sb.append("<h2>").append(escapeHtml(suite.name())).append(' ').append(badge(suite.status())).append("</h2>\n");

        if (!suite.individualTests().isEmpty()) {
            sb.append("<table>\n<thead><tr><th>Test</th><th>Status</th></tr></thead>\n<tbody>\n");
            for (Map.Entry<String, TestStatus> test : new TreeMap<>(suite.individualTests()).entrySet()) {
                SuiteStatus shown = test.getValue() == TestStatus.PASSED ? SuiteStatus.PASSED : SuiteStatus.FAILED;
                sb.append("<tr><td>").append(escapeHtml(test.getKey())).append("</td><td>")
                        .append(badge(shown)).append("</td></tr>\n");
            }
            sb.append("</tbody></table>\n");
        }

        if (!suite.passed()) {
            sb.append("<pre class=\"logs\">").append(escapeHtml(ReportRenderer.logDump(suite.logs()))).append("</pre>\n");
        }
        sb.append("</div>\n");
        return sb.toString();
    }

    // ─── Utilities ───

    private static String badge(SuiteStatus status) {
        String css = switch (status) {
            case PASSED -> "badge-pass";
            case FAILED -> "badge-fail";
            case RUNNING, INCOMPLETE -> "badge-incomplete";
        };
        return "<span class=\"badge " + css + "\">" + status.label().toUpperCase(Locale.ROOT) + "</span>";
    }

    static String escapeHtml(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
