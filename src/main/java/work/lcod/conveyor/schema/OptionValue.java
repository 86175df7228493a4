package work.lcod.conveyor.schema;

import java.util.List;

/**
 * Enumerated input option with its canonical wire label and accepted legacy spellings.
 */
public interface OptionValue {
    String value();

    default List<String> aliases() {
        return List.of();
    }
}
