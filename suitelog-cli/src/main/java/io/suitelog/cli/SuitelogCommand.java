package io.suitelog.cli;

import io.suitelog.api.config.AnalyzerConfig;
import io.suitelog.core.diagnostics.MicrometerDiagnostics;
import io.suitelog.core.pipeline.AnalysisResult;
import io.suitelog.core.pipeline.LogAnalysis;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: suitelog [--input FILE] [--output FILE] [--html-report FILE] [--json-report FILE]
 * <p>
 * Analyses the browser harness log and exits 0 only if every suite passed.
 * Options fall back to {@code SUITELOG_INPUT}, {@code GITHUB_OUTPUT},
 * {@code SUITELOG_HTML_REPORT} and {@code SUITELOG_JSON_REPORT}.
 */
@Command(
        name = "suitelog",
        mixinStandardHelpOptions = true,
        version = "Suitelog 0.1.0",
        description = "Turns browser test harness console logs into a CI verdict"
)
public class SuitelogCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, paramLabel = "FILE",
            description = "Harness log, one JSON record per line (default: $SUITELOG_INPUT or post_data.log)")
    private String input;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "CI key/value output file (default: $GITHUB_OUTPUT)")
    private String output;

    @Option(names = "--html-report", paramLabel = "FILE", description = "Also write an HTML report")
    private String htmlReport;

    @Option(names = "--json-report", paramLabel = "FILE", description = "Also write a JSON report")
    private String jsonReport;

    @Option(names = "--group-title", paramLabel = "TITLE",
            description = "Title of the console result group (default: ${DEFAULT-VALUE})",
            defaultValue = AnalyzerConfig.DEFAULT_GROUP_TITLE)
    private String groupTitle;

    private final Map<String, String> environment;
    private final PrintStream console;

    public SuitelogCommand() {
        this(System.getenv(), System.out);
    }

    public SuitelogCommand(Map<String, String> environment, PrintStream console) {
        this.environment = environment;
        this.console = console;
    }

    @Override
    public Integer call() {
        AnalysisResult result = new LogAnalysis(config(), new MicrometerDiagnostics(), console).run();
        return result.exitCode();
    }

    AnalyzerConfig config() {
        AnalyzerConfig config = AnalyzerConfig.fromEnvironment(environment).groupTitle(groupTitle);
        if (input != null) {
            config.inputPath(input);
        }
        if (output != null) {
            config.outputPath(output);
        }
        if (htmlReport != null) {
            config.htmlReportPath(htmlReport);
        }
        if (jsonReport != null) {
            config.jsonReportPath(jsonReport);
        }
        return config;
    }
}
