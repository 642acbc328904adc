package net.littleredcomputer.hilbert;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders the progress and results of a proof search as text. All wording, ordering and layout
 * decisions are made here; the sink only stores lines.
 */
public class ProofReport implements SearchListener {
    private static final DateTimeFormatter ctime = DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy", Locale.US);
    private static final Joiner commaJoiner = Joiner.on(", ");
    private static final String headerRule = Strings.repeat("=", 30);
    private static final String proofRule = Strings.repeat("-", 20);

    private final ReportSink out;

    public ProofReport(ReportSink out) {
        this.out = out;
    }

    public void header(LocalDateTime start, SearchConfiguration config) {
        out.println("Starting proof generation at " + ctime.format(start));
        out.println("Max Length: " + config.maxLength());
        out.println("Basis Size: " + config.basis().size());
        out.println(headerRule);
        out.println();
        out.flush();
    }

    @Override
    public void axiomsGenerated(SearchConfiguration config, int instanceCount) {
        out.println("--- Generating all Axiom instances (Length 1) ---");
        out.println("Using WFF Basis (size " + config.basis().size() + "): " + formatBasis(config.basis()));
        out.println();
        out.println("Found " + instanceCount + " unique length-1 proofs.");
        out.println();
    }

    @Override
    public void searchStarted(int maxLength) {
        out.println("--- Searching for proofs up to length " + maxLength + " ---");
        out.flush();
    }

    @Override
    public void layerStarted(int length, int previousLayerSize) {
        out.println("Generating proofs of length " + length + " from " + previousLayerSize
                + " proofs of length " + (length - 1) + "...");
        out.flush();
    }

    @Override
    public void layerCompleted(int length, int size) {
        out.println("Found " + size + " new unique proofs of length " + length + ".");
        out.flush();
    }

    @Override
    public void nothingToExtend(int length) {
        out.println("No proofs of length " + length + " found, stopping search.");
    }

    @Override
    public void nothingNew(int length) {
        out.println("No new proofs of length " + length + " found, stopping search.");
    }

    @Override
    public void searchCompleted(SearchResult result) {
        out.println();
        out.println("--- Search Complete ---");
        out.println("Found a total of " + result.totalProofCount() + " proofs (including non-minimal).");
        out.flush();
    }

    /**
     * Write the minimization summary and, if there is anything to show, every best proof in
     * {@link TheoremMinimizer#REPORT_ORDER}.
     */
    public void theorems(TheoremMinimizer m) {
        out.println("Found " + m.modusPonensProofCount() + " proofs of length "
                + TheoremMinimizer.MIN_REPORTED_LENGTH + " or more that use Modus Ponens.");
        if (m.modusPonensProofCount() == 0) {
            out.println("No proofs found with length " + TheoremMinimizer.MIN_REPORTED_LENGTH
                    + " or more that use MP.");
            return;
        }
        out.println("Filtering down to the simplest proof for each of " + m.theoremCount() + " unique theorems...");
        out.println();
        m.sorted().forEach(this::proof);
    }

    /**
     * Write one proof as a numbered list. Formulas are padded to the width of the longest one so
     * the justifications line up.
     */
    public void proof(Proof p) {
        int width = 0;
        for (String s : p.steps()) width = Math.max(width, s.length());
        for (int i = 0; i < p.length(); ++i) {
            out.println("  " + (i + 1) + ". " + Strings.padEnd(p.step(i), width, ' ') + "   " + p.justifications().get(i));
        }
        out.println(proofRule);
    }

    public void elapsed(Duration d) {
        out.println();
        out.println("Total execution time: " + formatSeconds(d) + " seconds.");
        out.flush();
    }

    static String formatSeconds(Duration d) {
        return String.format(Locale.ROOT, "%.4f", d.toNanos() / 1e9);
    }

    private static String formatBasis(List<String> basis) {
        StringBuilder s = new StringBuilder("[");
        commaJoiner.appendTo(s, basis.stream().map(f -> "'" + f + "'").iterator());
        return s.append(']').toString();
    }
}
