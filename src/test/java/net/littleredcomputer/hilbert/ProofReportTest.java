package net.littleredcomputer.hilbert;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class ProofReportTest {
    private static final Joiner lines = Joiner.on('\n');

    @Test
    public void fullReport() {
        StringWriter w = new StringWriter();
        ProofReport report = new ProofReport(new WriterReportSink(w));
        SearchConfiguration config = new SearchConfiguration(3, ImmutableList.of("a"));
        report.header(LocalDateTime.of(2018, 3, 4, 5, 6, 7), config);
        SearchResult result = new ProofSearch(config).setListener(report).run();
        report.theorems(TheoremMinimizer.of(result));
        report.elapsed(Duration.ofMillis(1500));
        assertThat(w.toString(), is(lines.join(
                "Starting proof generation at Sun Mar  4 05:06:07 2018",
                "Max Length: 3",
                "Basis Size: 1",
                "==============================",
                "",
                "--- Generating all Axiom instances (Length 1) ---",
                "Using WFF Basis (size 1): ['a']",
                "",
                "Found 3 unique length-1 proofs.",
                "",
                "--- Searching for proofs up to length 3 ---",
                "Generating proofs of length 2 from 3 proofs of length 1...",
                "Found 9 new unique proofs of length 2.",
                "Generating proofs of length 3 from 9 proofs of length 2...",
                "Found 29 new unique proofs of length 3.",
                "",
                "--- Search Complete ---",
                "Found a total of 41 proofs (including non-minimal).",
                "Found 2 proofs of length 3 or more that use Modus Ponens.",
                "Filtering down to the simplest proof for each of 1 unique theorems...",
                "",
                "  1. (a → (a → a))                           A1 [A=a, B=a]",
                "  2. ((a → (a → a)) → ((a → a) → (a → a)))   A2 [A=a, B=a, C=a]",
                "  3. ((a → a) → (a → a))                     MP (1,2)",
                "--------------------",
                "",
                "Total execution time: 1.5000 seconds.",
                "")));
    }

    @Test
    public void nothingToMinimize() {
        StringWriter w = new StringWriter();
        ProofReport report = new ProofReport(new WriterReportSink(w));
        report.theorems(TheoremMinimizer.of(new ProofSearch(new SearchConfiguration(2, ImmutableList.of("a"))).run()));
        assertThat(w.toString(), is(lines.join(
                "Found 0 proofs of length 3 or more that use Modus Ponens.",
                "No proofs found with length 3 or more that use MP.",
                "")));
    }

    @Test
    public void stepsAlignedToLongestFormula() {
        StringWriter w = new StringWriter();
        Proof p = Proof.of("(a → (b → a))", Justification.axiom(AxiomSchema.A1, ImmutableMap.of("A", "a", "B", "b")))
                .extend("a", Justification.axiom(AxiomSchema.A1, ImmutableMap.of("A", "a", "B", "a")))
                .extend("(b → a)", Justification.modusPonens(2, 1));
        new ProofReport(new WriterReportSink(w)).proof(p);
        assertThat(w.toString(), is(lines.join(
                "  1. (a → (b → a))   A1 [A=a, B=b]",
                "  2. a               A1 [A=a, B=a]",
                "  3. (b → a)         MP (2,1)",
                "--------------------",
                "")));
    }

    @Test
    public void secondsToFourPlaces() {
        assertThat(ProofReport.formatSeconds(Duration.ofNanos(123456789)), is("0.1235"));
        assertThat(ProofReport.formatSeconds(Duration.ofSeconds(62)), is("62.0000"));
    }

    @Test
    public void writeFailuresSurfaceAsReportException() {
        Writer broken = new Writer() {
            @Override public void write(char[] cbuf, int off, int len) throws IOException { throw new IOException("disk full"); }
            @Override public void flush() throws IOException { throw new IOException("disk full"); }
            @Override public void close() {}
        };
        ProofSearch search = new ProofSearch(new SearchConfiguration(2, ImmutableList.of("a")))
                .setListener(new ProofReport(new WriterReportSink(broken)));
        try {
            search.run();
            fail("expected the report to fail");
        } catch (ReportException e) {
            assertThat(e.getCause(), is(instanceOf(IOException.class)));
        }
    }
}
