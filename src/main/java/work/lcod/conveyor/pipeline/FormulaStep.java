package work.lcod.conveyor.pipeline;

import java.util.Map;

/**
 * A pipeline stage: reads the canonical input, the parameters and earlier outputs, and returns
 * the outputs it produces. A {@code null} value means the output does not apply to this input.
 */
@FunctionalInterface
public interface FormulaStep {
    Map<String, Object> compute(StepContext ctx);
}
