package net.littleredcomputer.hilbert;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Splitter semicolonSplitter = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final String defaultOutput = "proof_output.txt";

    private static Options options() {
        return new Options()
                .addOption("maxlength", true, "longest proof to search for (default " + SearchConfiguration.DEFAULT_MAX_LENGTH + ")")
                .addOption("basis", true, "standard, small, or a ;-separated list of ground formulas")
                .addOption("output", true, "file to write the report to (default " + defaultOutput + ")");
    }

    static List<String> basis(CommandLine cmd) {
        String b = cmd.getOptionValue("basis", "standard");
        switch (b) {
            case "standard": return SearchConfiguration.STANDARD_BASIS;
            case "small": return SearchConfiguration.SMALL_BASIS;
            default: return semicolonSplitter.splitToList(b);
        }
    }

    static SearchConfiguration configuration(CommandLine cmd) {
        int maxLength = Integer.parseInt(cmd.getOptionValue("maxlength", String.valueOf(SearchConfiguration.DEFAULT_MAX_LENGTH)));
        return new SearchConfiguration(maxLength, basis(cmd));
    }

    static CommandLine parse(String[] args) throws ParseException {
        return new DefaultParser().parse(options(), args);
    }

    /**
     * Search, minimize and write the complete report, including the closing timing line.
     */
    static void run(SearchConfiguration config, ReportSink sink, Stopwatch stopwatch) {
        ProofReport report = new ProofReport(sink);
        report.header(LocalDateTime.now(), config);
        SearchResult result = new ProofSearch(config).setListener(report).run();
        report.theorems(TheoremMinimizer.of(result));
        report.elapsed(stopwatch.elapsed());
    }

    enum Failure {
        REPORT,
        SEARCH,
    }

    interface SinkOpener {
        WriterReportSink open() throws IOException;
    }

    /**
     * Run the search and write the report inside a single failure boundary. Failures are logged
     * with the time elapsed so far; output problems are told apart from everything else,
     * including running out of memory or stack.
     *
     * @return the kind of failure, or empty if the report was written completely
     */
    static Optional<Failure> runReporting(SearchConfiguration config, String output, SinkOpener opener, Stopwatch sw) {
        try (WriterReportSink sink = opener.open()) {
            run(config, sink, sw);
            return Optional.empty();
        } catch (IOException | ReportException e) {
            fail("unable to write report to " + output, e, sw.elapsed());
            return Optional.of(Failure.REPORT);
        } catch (RuntimeException | VirtualMachineError e) {
            fail("proof search failed", e, sw.elapsed());
            return Optional.of(Failure.SEARCH);
        }
    }

    public static void main(String[] args) throws ParseException {
        CommandLine cmd = parse(args);
        SearchConfiguration config = configuration(cmd);
        String output = cmd.getOptionValue("output", defaultOutput);
        Stopwatch sw = Stopwatch.createStarted();
        Optional<Failure> failure = runReporting(config, output, () -> new WriterReportSink(new BufferedWriter(
                new OutputStreamWriter(Files.newOutputStream(Paths.get(output)), StandardCharsets.UTF_8))), sw);
        if (failure.isPresent()) System.exit(1);
        Duration d = sw.elapsed();
        System.out.println("Successfully wrote output to " + output);
        System.out.println("Total execution time: " + ProofReport.formatSeconds(d) + " seconds.");
    }

    private static void fail(String what, Throwable t, Duration elapsed) {
        log.error("%s: %s", what, t);
        log.error("Total execution time before error: %s seconds.", ProofReport.formatSeconds(elapsed));
    }
}
