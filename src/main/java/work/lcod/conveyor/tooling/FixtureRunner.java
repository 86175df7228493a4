package work.lcod.conveyor.tooling;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import picocli.CommandLine;
import work.lcod.conveyor.api.CalculationEngine;
import work.lcod.conveyor.config.ParametersLoader;
import work.lcod.conveyor.fixture.FieldFailure;
import work.lcod.conveyor.fixture.FixtureEvaluator;
import work.lcod.conveyor.fixture.FixtureLoader;
import work.lcod.conveyor.fixture.FixtureReport;
import work.lcod.conveyor.schema.Parameters;

@CommandLine.Command(
    name = "conveyor-fixtures",
    description = "Run recorded conveyor fixtures and report output mismatches",
    mixinStandardHelpOptions = true
)
public final class FixtureRunner implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    static final String[] REPORT_HEADER = {"fixture", "status", "field", "expected", "actual", "abs_diff", "pct_diff"};

    @CommandLine.Option(names = {"-d", "--dir"}, description = "Directory holding fixture files",
        defaultValue = "src/test/resources/fixtures")
    private Path directory;

    @CommandLine.Option(names = "--params", description = "TOML file with a [parameters] table applied to every fixture")
    private Path paramsFile;

    @CommandLine.Option(names = "--json", description = "Print JSON results instead of one line per fixture")
    private boolean json;

    @CommandLine.Option(names = "--report", description = "Write a CSV report of every field failure")
    private Path reportFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FixtureRunner()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        var fixtures = FixtureLoader.loadAll(directory);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (fixtures.isEmpty()) {
            err.println("No fixtures found under " + directory);
            return 1;
        }
        var parameters = paramsFile != null
            ? ParametersLoader.load(paramsFile, Parameters.defaults())
            : Parameters.defaults();
        var evaluator = new FixtureEvaluator(new CalculationEngine(Clock.systemUTC(), parameters));
        List<FixtureReport> reports = evaluator.evaluateAll(fixtures);

        if (json) {
            out.println(JSON.writerWithDefaultPrettyPrinter()
                .writeValueAsString(reports.stream().map(FixtureReport::toMap).toList()));
        } else {
            for (FixtureReport report : reports) {
                printLine(report, out, err);
            }
        }
        if (reportFile != null) {
            writeCsvReport(reports, reportFile);
        }
        out.flush();
        err.flush();
        long blocking = reports.stream().filter(FixtureReport::blocksPublish).count();
        return blocking == 0 ? 0 : 1;
    }

    private static void printLine(FixtureReport report, PrintWriter out, PrintWriter err) {
        String tag = report.status().value();
        if (report.passed()) {
            out.println("✅ " + report.name() + " [" + tag + "]");
            return;
        }
        err.println("❌ " + report.name() + " [" + tag + "]");
        report.error().ifPresent(e -> err.println("    " + e));
        for (FieldFailure failure : report.failures()) {
            err.println("    " + failure.describe());
        }
        for (String field : report.missingErrors()) {
            err.println("    expected an error on " + field);
        }
        for (String field : report.missingWarnings()) {
            err.println("    expected a warning on " + field);
        }
    }

    static void writeCsvReport(List<FixtureReport> reports, Path target) throws IOException {
        var parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writeCsv(reports, writer);
        }
    }

    static void writeCsv(List<FixtureReport> reports, Appendable target) throws IOException {
        var format = CSVFormat.DEFAULT.builder().setHeader(REPORT_HEADER).build();
        try (var printer = new CSVPrinter(target, format)) {
            for (FixtureReport report : reports) {
                for (FieldFailure failure : report.failures()) {
                    printer.printRecord(report.name(), report.status().value(), failure.field(), failure.expected(),
                        failure.actual(), failure.absDiff(), failure.pctDiff());
                }
                for (String field : report.missingErrors()) {
                    printer.printRecord(report.name(), report.status().value(), field, "error", "", "", "");
                }
                for (String field : report.missingWarnings()) {
                    printer.printRecord(report.name(), report.status().value(), field, "warning", "", "", "");
                }
                if (report.error().isPresent()) {
                    printer.printRecord(report.name(), report.status().value(), "", "", report.error().get(), "", "");
                }
            }
        }
    }
}
