package work.lcod.conveyor.migrate;

import java.util.Map;

/**
 * One pure normalization step: returns a new field map and never mutates its argument.
 * Each step only acts when the fields it fills in are absent, so re-applying it is a no-op.
 */
@FunctionalInterface
public interface MigrationStep {
    Map<String, Object> apply(Map<String, Object> fields);
}
