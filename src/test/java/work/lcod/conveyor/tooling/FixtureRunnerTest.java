package work.lcod.conveyor.tooling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.conveyor.fixture.FieldFailure;
import work.lcod.conveyor.fixture.Fixture;
import work.lcod.conveyor.fixture.FixtureReport;

class FixtureRunnerTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures");

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void goldenFixturesPassAndPendingIsReported() {
        int code = run("-d", FIXTURES.toString());
        assertEquals(0, code, err.toString());
        assertTrue(out.toString().contains("✅ flat parts conveyor at 100 fpm [golden]"));
        assertTrue(err.toString().contains("❌ bottom mount drive awaiting recorded torque [pending]"));
        assertTrue(err.toString().contains("torque_drive_shaft_inlbf: expected 500"));
    }

    @Test
    void emptyDirectoryFails(@TempDir Path tmp) {
        assertEquals(1, run("-d", tmp.toString()));
        assertTrue(err.toString().contains("No fixtures found"));
    }

    @Test
    void failingGoldenFixtureBlocks(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("wrong.yaml"), String.join("\n",
            "name: wrong belt length",
            "inputs:",
            "  conveyor_length_cc_in: 120",
            "  belt_width_in: 24",
            "  speed_mode: belt_speed",
            "  belt_speed_fpm: 100",
            "  part_weight_lbs: 5",
            "  part_length_in: 12",
            "  part_width_in: 6",
            "  part_spacing_in: 12",
            "expected_outputs:",
            "  total_belt_length_in: 200",
            ""));
        var report = tmp.resolve("out").resolve("report.csv");
        assertEquals(1, run("-d", tmp.toString(), "--report", report.toString()));
        var lines = Files.readAllLines(report);
        assertEquals("fixture,status,field,expected,actual,abs_diff,pct_diff", lines.get(0));
        assertTrue(lines.get(1).startsWith("wrong belt length,golden,total_belt_length_in,200,"), lines.get(1));
    }

    @Test
    void jsonModePrintsReports() {
        assertEquals(0, run("-d", FIXTURES.toString(), "--json"));
        assertTrue(out.toString().contains("\"name\" : \"legacy example - basic conveyor\""));
        assertTrue(out.toString().contains("\"passed\" : false"));
    }

    @Test
    void csvRowsCoverEveryKindOfFailure() throws Exception {
        var reports = List.of(
            new FixtureReport("demo", Fixture.Status.GOLDEN,
                List.of(new FieldFailure("gear_ratio", 10, 12.0, 2.0, 20.0)),
                List.of("belt_width_in"), List.of(), Optional.empty()),
            new FixtureReport("broken", Fixture.Status.PENDING, List.of(), List.of(), List.of("drop_height_in"),
                Optional.of("boom")));
        var csv = new StringBuilder();
        FixtureRunner.writeCsv(reports, csv);
        var lines = csv.toString().split("\r\n");
        assertEquals(List.of(
            "fixture,status,field,expected,actual,abs_diff,pct_diff",
            "demo,golden,gear_ratio,10,12.0,2.0,20.0",
            "demo,golden,belt_width_in,error,,,",
            "broken,pending,drop_height_in,warning,,,",
            "broken,pending,,,boom,,"
        ), List.of(lines));
    }

    private int run(String... args) {
        var cmd = new CommandLine(new FixtureRunner());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }
}
