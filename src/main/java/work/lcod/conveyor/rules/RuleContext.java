package work.lcod.conveyor.rules;

import java.util.Objects;
import work.lcod.conveyor.formula.CalculationOutput;
import work.lcod.conveyor.schema.CanonicalInput;
import work.lcod.conveyor.schema.Parameters;

/**
 * Everything a rule may look at. Rules never see anything else, so re-validating the same
 * triple always yields the same findings.
 */
public record RuleContext(CanonicalInput input, Parameters parameters, CalculationOutput output) {
    public RuleContext {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(output, "output");
    }
}
