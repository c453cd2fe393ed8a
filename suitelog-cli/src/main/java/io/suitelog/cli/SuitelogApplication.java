package io.suitelog.cli;

import picocli.CommandLine;

/**
 * Entry point. Exit status: 0 all suites passed, 1 otherwise, 2 invalid usage.
 * <p>
 * Run with:
 * <pre>{@code
 * mvn -q install -DskipTests
 * mvn exec:java -pl suitelog-cli \
 *   -Dexec.mainClass="io.suitelog.cli.SuitelogApplication" \
 *   -Dexec.args="--input post_data.log"
 * }</pre>
 */
public final class SuitelogApplication {

    private SuitelogApplication() {}

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SuitelogCommand()).execute(args);
        System.exit(exitCode);
    }
}
