package work.lcod.conveyor.rules;

/**
 * A group of related checks appending findings in a fixed order.
 */
@FunctionalInterface
public interface RuleSet {
    void check(RuleContext ctx, FindingCollector out);
}
