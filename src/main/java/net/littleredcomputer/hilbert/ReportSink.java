package net.littleredcomputer.hilbert;

/**
 * Destination for the text of a report. Implementations report failure by throwing
 * {@link ReportException}.
 */
public interface ReportSink {
    /** Write text followed by a line terminator. */
    void println(String text);

    default void println() { println(""); }

    /** Push anything buffered so far to its destination. */
    void flush();
}
