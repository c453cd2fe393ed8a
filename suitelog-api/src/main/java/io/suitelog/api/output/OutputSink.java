package io.suitelog.api.output;

/**
 * Line-oriented key/value channel read by the CI system after the run.
 */
public interface OutputSink extends AutoCloseable {

    /**
     * Append one named output. Failures are reported as diagnostics, never thrown.
     *
     * @param name  output name
     * @param value output value, may span several lines
     */
    void emit(String name, String value);

    /**
     * Flush and release the underlying resource.
     */
    @Override
    void close();
}
