package work.lcod.conveyor.rules;

import work.lcod.conveyor.schema.Parameters;

/**
 * Sanity ranges for the parameter bundle after overrides.
 */
final class ParameterRules implements RuleSet {
    @Override
    public void check(RuleContext ctx, FindingCollector out) {
        var params = ctx.parameters();
        if (params.frictionCoeff() < 0.1 || params.frictionCoeff() > 1.0) {
            out.error(Parameters.FRICTION_COEFF, "vp_friction_coeff_range", "Friction coefficient must be between 0.1 and 1.0");
        }
        if (params.safetyFactor() < 1.0) {
            out.error(Parameters.SAFETY_FACTOR, "vp_safety_factor_min", "Safety factor must be >= 1.0");
        }
        if (params.startingBeltPullLb() < 0) {
            out.error(Parameters.STARTING_BELT_PULL_LB, "vp_starting_pull_min", "Starting belt pull must be >= 0");
        }
        if (params.motorRpm() <= 0) {
            out.error(Parameters.MOTOR_RPM, "vp_motor_rpm_zero", "Motor RPM must be greater than 0");
        }
        if (params.gravityInPerS2() <= 0) {
            out.error(Parameters.GRAVITY_IN_PER_S2, "vp_gravity_zero", "Gravity constant must be greater than 0");
        }
    }
}
