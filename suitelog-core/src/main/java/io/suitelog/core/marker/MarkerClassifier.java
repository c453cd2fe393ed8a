package io.suitelog.core.marker;

import io.suitelog.api.marker.Marker;
import io.suitelog.api.record.LogRecord;
import io.suitelog.api.suite.SuiteCounts;
import io.suitelog.api.suite.TestStatus;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single log line by the fixed marker phrases the harness prints.
 * <p>
 * Classification looks at one record only and never fails: a marker phrase whose
 * trailing text has the wrong shape is {@link Marker.Plain}. Checked in order:
 * <ol>
 *   <li>{@code Starting test suite: <name>}</li>
 *   <li>{@code Finished test suite: <name> <StatusWord> (<passed>/<total>)}</li>
 *   <li>{@code Expect Test: <testName> <Passed|Failed|Error>}</li>
 * </ol>
 */
public final class MarkerClassifier {

    public static final String SUITE_START = "Starting test suite:";
    public static final String SUITE_END = "Finished test suite:";
    public static final String EXPECT_RESULT = "Expect Test:";

    /** Lines tagged with this are never treated as markers. */
    public static final String IGNORE_TAG = "(.gitignore)";

    private static final Pattern STYLE_DIRECTIVE = Pattern.compile("%c");
    private static final Pattern STYLE_ARGUMENT = Pattern.compile("color:\\s.*?\\s\\s");

    private static final Pattern START = Pattern.compile(Pattern.quote(SUITE_START) + "\\s*(.*?)\\s*$");
    private static final Pattern END = Pattern.compile(
            Pattern.quote(SUITE_END) + "\\s*(\\S.*?)\\s+((\\w+)\\s*\\((\\d+)/(\\d+)\\).*?)\\s*$");
    private static final Pattern EXPECT = Pattern.compile(
            Pattern.quote(EXPECT_RESULT) + "\\s*(\\S.*?)\\s+(Passed|Failed|Error)\\b.*$");

    private MarkerClassifier() {}

    public static Marker classify(LogRecord record) {
        return classify(record.text());
    }

    public static Marker classify(String rawText) {
        String text = stripConsoleStyling(rawText);
        if (text.contains(IGNORE_TAG)) {
            return Marker.Plain.INSTANCE;
        }

        if (text.contains(SUITE_START)) {
            Matcher m = START.matcher(text);
            if (m.find() && !m.group(1).isEmpty()) {
                return new Marker.SuiteStart(m.group(1));
            }
        }

        if (text.contains(SUITE_END)) {
            Matcher m = END.matcher(text);
            if (m.find()) {
                SuiteCounts counts = counts(m.group(4), m.group(5));
                if (counts != null) {
                    return new Marker.SuiteEnd(m.group(1), m.group(2), counts);
                }
            }
        }

        if (text.contains(EXPECT_RESULT)) {
            Matcher m = EXPECT.matcher(text);
            if (m.find()) {
                TestStatus status = "Passed".equals(m.group(2)) ? TestStatus.PASSED : TestStatus.FAILED;
                return new Marker.ExpectResult(m.group(1), status);
            }
        }
        return Marker.Plain.INSTANCE;
    }

    /**
     * Remove browser console styling: {@code %c} directives and the CSS {@code color: x}
     * arguments that the harness appends to its messages.
     */
    static String stripConsoleStyling(String text) {
        String stripped = STYLE_DIRECTIVE.matcher(text).replaceAll("");
        return STYLE_ARGUMENT.matcher(stripped).replaceAll("");
    }

    // counts too large for an int are not a valid end marker
    private static SuiteCounts counts(String passed, String total) {
        try {
            return new SuiteCounts(Integer.parseInt(passed), Integer.parseInt(total));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
