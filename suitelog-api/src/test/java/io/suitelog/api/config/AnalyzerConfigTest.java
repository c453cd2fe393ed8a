package io.suitelog.api.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerConfigTest {

    @Test
    void shouldUseDefaults() {
        var config = AnalyzerConfig.create();

        assertThat(config.inputPath()).isEqualTo(Path.of("post_data.log"));
        assertThat(config.outputPath()).isNull();
        assertThat(config.htmlReportPath()).isNull();
        assertThat(config.jsonReportPath()).isNull();
        assertThat(config.groupTitle()).isEqualTo("Test Suite Results");
    }

    @Test
    void shouldReadEnvironment() {
        var config = AnalyzerConfig.fromEnvironment(Map.of(
                "SUITELOG_INPUT", "logs/console.log",
                "GITHUB_OUTPUT", "/tmp/gh_out",
                "SUITELOG_HTML_REPORT", "build/report.html",
                "SUITELOG_JSON_REPORT", "build/report.json"));

        assertThat(config.inputPath()).isEqualTo(Path.of("logs/console.log"));
        assertThat(config.outputPath()).isEqualTo(Path.of("/tmp/gh_out"));
        assertThat(config.htmlReportPath()).isEqualTo(Path.of("build/report.html"));
        assertThat(config.jsonReportPath()).isEqualTo(Path.of("build/report.json"));
    }

    @Test
    void blankEnvironmentValuesShouldKeepDefaults() {
        var config = AnalyzerConfig.fromEnvironment(Map.of("SUITELOG_INPUT", "  ", "GITHUB_OUTPUT", ""));

        assertThat(config.inputPath()).isEqualTo(Path.of("post_data.log"));
        assertThat(config.outputPath()).isNull();
    }

    @Test
    void shouldRejectBlankInputAndTitle() {
        var config = AnalyzerConfig.create();

        assertThatThrownBy(() -> config.inputPath(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.groupTitle("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankOptionalPathsShouldClearThem() {
        var config = AnalyzerConfig.create()
                .outputPath("out")
                .htmlReportPath("report.html")
                .outputPath("")
                .htmlReportPath(null);

        assertThat(config.outputPath()).isNull();
        assertThat(config.htmlReportPath()).isNull();
    }
}
