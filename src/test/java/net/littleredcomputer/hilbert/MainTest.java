package net.littleredcomputer.hilbert;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.commons.cli.ParseException;
import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class MainTest {

    @Test
    public void defaults() throws ParseException {
        SearchConfiguration c = Main.configuration(Main.parse(new String[0]));
        assertThat(c.maxLength(), is(SearchConfiguration.DEFAULT_MAX_LENGTH));
        assertThat(c.basis(), is(SearchConfiguration.STANDARD_BASIS));
    }

    @Test
    public void namedBasis() throws ParseException {
        SearchConfiguration c = Main.configuration(Main.parse(new String[]{"-basis", "small", "-maxlength", "4"}));
        assertThat(c.maxLength(), is(4));
        assertThat(c.basis(), is(SearchConfiguration.SMALL_BASIS));
    }

    @Test
    public void explicitBasis() throws ParseException {
        SearchConfiguration c = Main.configuration(Main.parse(new String[]{"-basis", "a; (¬a) ;(a → a)"}));
        assertThat(c.basis(), contains("a", "(¬a)", "(a → a)"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badLength() throws ParseException {
        Main.configuration(Main.parse(new String[]{"-maxlength", "0"}));
    }

    @Test
    public void runWritesCompleteReport() throws ParseException {
        StringWriter w = new StringWriter();
        Main.run(Main.configuration(Main.parse(new String[]{"-basis", "a;b", "-maxlength", "3"})),
                new WriterReportSink(w), Stopwatch.createStarted());
        String report = w.toString();
        assertThat(report, containsString("Basis Size: 2\n"));
        assertThat(report, containsString("Found 4104 new unique proofs of length 3.\n"));
        assertThat(report, containsString("Filtering down to the simplest proof for each of 4 unique theorems...\n"));
        assertThat(report, containsString("  3. ((a → b) → (a → a))                     MP (1,2)\n"));
        assertThat(report.indexOf("((a → a) → (a → a))") < report.indexOf("((b → b) → (b → b))"), is(true));
        assertThat(report, containsString("\nTotal execution time: "));
    }

    private static Writer failingWith(Throwable t) {
        return new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                if (t instanceof IOException) throw (IOException) t;
                if (t instanceof Error) throw (Error) t;
                throw (RuntimeException) t;
            }
            @Override public void flush() {}
            @Override public void close() {}
        };
    }

    private static final SearchConfiguration small = new SearchConfiguration(3, ImmutableList.of("a"));

    @Test
    public void completeRunHasNoFailure() {
        StringWriter w = new StringWriter();
        assertThat(Main.runReporting(new SearchConfiguration(3, SearchConfiguration.SMALL_BASIS.subList(0, 1)), "out",
                () -> new WriterReportSink(w), Stopwatch.createStarted()), isEmpty());
        assertThat(w.toString(), containsString("Total execution time: "));
    }

    @Test
    public void outOfMemoryIsSearchFailure() {
        assertThat(Main.runReporting(small, "out",
                () -> new WriterReportSink(failingWith(new OutOfMemoryError("Java heap space"))), Stopwatch.createStarted()),
                isPresentAndIs(Main.Failure.SEARCH));
    }

    @Test
    public void stackOverflowIsSearchFailure() {
        assertThat(Main.runReporting(small, "out",
                () -> new WriterReportSink(failingWith(new StackOverflowError())), Stopwatch.createStarted()),
                isPresentAndIs(Main.Failure.SEARCH));
    }

    @Test
    public void runtimeExceptionIsSearchFailure() {
        assertThat(Main.runReporting(small, "out",
                () -> new WriterReportSink(failingWith(new IllegalStateException("broken"))), Stopwatch.createStarted()),
                isPresentAndIs(Main.Failure.SEARCH));
    }

    @Test
    public void unwritableReportIsReportFailure() {
        assertThat(Main.runReporting(small, "out",
                () -> new WriterReportSink(failingWith(new IOException("disk full"))), Stopwatch.createStarted()),
                isPresentAndIs(Main.Failure.REPORT));
    }

    @Test
    public void unopenableReportIsReportFailure() {
        assertThat(Main.runReporting(small, "/nonexistent/out", () -> {
            throw new IOException("no such directory");
        }, Stopwatch.createStarted()), isPresentAndIs(Main.Failure.REPORT));
    }
}
