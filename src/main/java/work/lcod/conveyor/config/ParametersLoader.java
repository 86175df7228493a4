package work.lcod.conveyor.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.conveyor.schema.Parameters;
import work.lcod.conveyor.shared.ConveyorCalcException;

/**
 * Reads parameter overrides from the {@code [parameters]} table of a TOML file:
 *
 * <pre>
 * [parameters]
 * friction_coeff = 0.3
 * safety_factor = 2.5
 * </pre>
 */
public final class ParametersLoader {
    public static final String TABLE = "parameters";

    private ParametersLoader() {}

    public static Map<String, Object> readOverrides(Path path) {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConveyorCalcException("invalid_config", "Cannot read parameters file: " + path, ex);
        }
        return parseOverrides(raw, path.toString());
    }

    public static Map<String, Object> parseOverrides(String toml, String source) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ConveyorCalcException("invalid_config", "Invalid TOML in " + source + ": " + messages,
                Map.of("source", source));
        }
        TomlTable table = result.getTable(TABLE);
        var overrides = new LinkedHashMap<String, Object>();
        if (table == null) {
            return overrides;
        }
        for (String key : table.keySet()) {
            var value = table.get(key);
            if (!(value instanceof Number)) {
                throw new ConveyorCalcException("invalid_config", "Parameter " + key + " in " + source + " must be a number",
                    Map.of("source", source, "name", key));
            }
            overrides.put(key, value);
        }
        return overrides;
    }

    public static Parameters load(Path path, Parameters base) {
        return base.withOverrides(readOverrides(path));
    }
}
