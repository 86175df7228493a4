package work.lcod.conveyor.rules;

import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.conveyor.formula.CalculationOutput;
import work.lcod.conveyor.formula.Outputs;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Fields;
import work.lcod.conveyor.schema.Parameters;

/**
 * Runs the rule sets in a fixed order and returns every finding they emit. Findings never throw;
 * an invalid configuration is reported, not rejected.
 */
public final class ValidationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ValidationEngine.class);

    static final String GEOMETRY_INVALID = "geometry_invalid";

    private static final Set<String> GEOMETRY_FIELDS = Set.of(
        Fields.GEOMETRY_MODE,
        Fields.CONVEYOR_LENGTH_CC_IN,
        Fields.HORIZONTAL_RUN_IN,
        Fields.TAIL_TOB_IN,
        Fields.DRIVE_TOB_IN);

    private static final List<RuleSet> RULE_SETS = List.of(
        new StructuralRules(),
        new ParameterRules(),
        new ConsistencyRules(),
        new SafetyRules());

    private ValidationEngine() {}

    public static List<Finding> validate(CanonicalInput input, Parameters parameters, CalculationOutput output) {
        var ctx = new RuleContext(input, parameters, output);
        var collector = new FindingCollector();
        for (RuleSet rules : RULE_SETS) {
            rules.check(ctx, collector);
        }
        // a resolver error is only worth showing when no field-level rule already explains it
        if (output.has(Outputs.GEOMETRY_VALID) && !output.flag(Outputs.GEOMETRY_VALID)
            && !collector.hasErrorOn(GEOMETRY_FIELDS)) {
            collector.error(Fields.GEOMETRY_MODE, GEOMETRY_INVALID,
                output.text(Outputs.GEOMETRY_ERROR).orElse("Geometry could not be resolved"));
        }
        var findings = collector.findings();
        if (LOG.isDebugEnabled()) {
            long errors = findings.stream().filter(Finding::isError).count();
            LOG.debug("validation produced {} findings ({} errors)", findings.size(), errors);
        }
        return findings;
    }
}
