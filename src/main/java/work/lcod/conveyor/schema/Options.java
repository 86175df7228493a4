package work.lcod.conveyor.schema;

import java.util.Optional;
import work.lcod.conveyor.shared.Values;

/**
 * Lenient lookup of {@link OptionValue} enums from payload values.
 */
public final class Options {
    private Options() {}

    public static <E extends Enum<E> & OptionValue> Optional<E> parse(Class<E> type, Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (type.isInstance(raw)) {
            return Optional.of(type.cast(raw));
        }
        var key = Values.labelKey(raw.toString());
        if (key.isEmpty()) {
            return Optional.empty();
        }
        for (E candidate : type.getEnumConstants()) {
            if (key.equals(Values.labelKey(candidate.value())) || key.equals(Values.labelKey(candidate.name()))) {
                return Optional.of(candidate);
            }
            for (String alias : candidate.aliases()) {
                if (key.equals(Values.labelKey(alias))) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * True when the raw value is present but matches none of the enum's labels.
     */
    public static <E extends Enum<E> & OptionValue> boolean isUnrecognized(Class<E> type, Object raw) {
        return raw != null && Values.asText(raw) != null && parse(type, raw).isEmpty();
    }
}
