package io.suitelog.api.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for one log analysis run.
 * Controls where the harness log is read from and where results are written.
 */
public final class AnalyzerConfig {

    public static final String DEFAULT_INPUT = "post_data.log";
    public static final String DEFAULT_GROUP_TITLE = "Test Suite Results";

    public static final String ENV_INPUT = "SUITELOG_INPUT";
    public static final String ENV_OUTPUT = "GITHUB_OUTPUT";
    public static final String ENV_HTML_REPORT = "SUITELOG_HTML_REPORT";
    public static final String ENV_JSON_REPORT = "SUITELOG_JSON_REPORT";

    private Path inputPath = Path.of(DEFAULT_INPUT);
    private Path outputPath = null; // null = no CI sink configured
    private Path htmlReportPath = null; // null = no report, set to generate
    private Path jsonReportPath = null;
    private String groupTitle = DEFAULT_GROUP_TITLE;

    private AnalyzerConfig() {}

    public static AnalyzerConfig create() {
        return new AnalyzerConfig();
    }

    /**
     * Build a configuration from environment-style variables.
     * Unset or blank variables keep their defaults.
     */
    public static AnalyzerConfig fromEnvironment(Map<String, String> env) {
        AnalyzerConfig config = create();
        String input = env.get(ENV_INPUT);
        if (!isBlank(input)) {
            config.inputPath(input);
        }
        String output = env.get(ENV_OUTPUT);
        if (!isBlank(output)) {
            config.outputPath(output);
        }
        String html = env.get(ENV_HTML_REPORT);
        if (!isBlank(html)) {
            config.htmlReportPath(html);
        }
        String json = env.get(ENV_JSON_REPORT);
        if (!isBlank(json)) {
            config.jsonReportPath(json);
        }
        return config;
    }

    public AnalyzerConfig inputPath(String inputPath) {
        if (isBlank(inputPath)) {
            throw new IllegalArgumentException("Input path must not be blank");
        }
        this.inputPath = Path.of(inputPath);
        return this;
    }

    public AnalyzerConfig inputPath(Path inputPath) {
        this.inputPath = Objects.requireNonNull(inputPath, "inputPath");
        return this;
    }

    /**
     * Set the CI key/value output file. If not set, outputs are not written.
     */
    public AnalyzerConfig outputPath(String outputPath) {
        this.outputPath = isBlank(outputPath) ? null : Path.of(outputPath);
        return this;
    }

    public AnalyzerConfig outputPath(Path outputPath) {
        this.outputPath = outputPath;
        return this;
    }

    /**
     * Set the path for generating an HTML report.
     * If not set, no report is generated.
     */
    public AnalyzerConfig htmlReportPath(String htmlReportPath) {
        this.htmlReportPath = isBlank(htmlReportPath) ? null : Path.of(htmlReportPath);
        return this;
    }

    public AnalyzerConfig jsonReportPath(String jsonReportPath) {
        this.jsonReportPath = isBlank(jsonReportPath) ? null : Path.of(jsonReportPath);
        return this;
    }

    public AnalyzerConfig groupTitle(String groupTitle) {
        if (isBlank(groupTitle)) {
            throw new IllegalArgumentException("Group title must not be blank");
        }
        this.groupTitle = groupTitle;
        return this;
    }

    public Path inputPath() { return inputPath; }
    public Path outputPath() { return outputPath; }
    public Path htmlReportPath() { return htmlReportPath; }
    public Path jsonReportPath() { return jsonReportPath; }
    public String groupTitle() { return groupTitle; }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
