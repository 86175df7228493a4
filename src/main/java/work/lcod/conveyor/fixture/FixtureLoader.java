package work.lcod.conveyor.fixture;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.conveyor.shared.ConveyorCalcException;

/**
 * Reads fixture files (YAML or JSON) from disk.
 */
public final class FixtureLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private FixtureLoader() {}

    public static Fixture load(Path path) {
        Map<String, Object> root;
        try {
            var mapper = isJson(path) ? JSON_MAPPER : YAML_MAPPER;
            root = mapper.readValue(Files.readString(path), new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (IOException ex) {
            throw new ConveyorCalcException("invalid_fixture", "Failed to read fixture: " + path, ex);
        }
        if (root == null) {
            throw new ConveyorCalcException("invalid_fixture", "Fixture is empty: " + path, Map.of("path", path.toString()));
        }
        return fromMap(root, defaultName(path));
    }

    /**
     * Loads every {@code .yaml}, {@code .yml} and {@code .json} file directly under the directory,
     * sorted by file name.
     */
    public static List<Fixture> loadAll(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new ConveyorCalcException("invalid_fixture", "Fixture directory not found: " + directory,
                Map.of("path", directory.toString()));
        }
        var fixtures = new ArrayList<Fixture>();
        try (var files = Files.list(directory)) {
            var paths = files
                .filter(Files::isRegularFile)
                .filter(FixtureLoader::isFixtureFile)
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .toList();
            for (Path path : paths) {
                fixtures.add(load(path));
            }
        } catch (IOException ex) {
            throw new ConveyorCalcException("invalid_fixture", "Failed to list fixtures: " + directory, ex);
        }
        return fixtures;
    }

    static Fixture fromMap(Map<String, Object> root, String fallbackName) {
        var name = root.get("name") instanceof String s && !s.isBlank() ? s : fallbackName;
        Fixture.Status status;
        try {
            status = Fixture.Status.parse(root.get("status") == null ? null : String.valueOf(root.get("status")));
        } catch (IllegalArgumentException ex) {
            throw new ConveyorCalcException("invalid_fixture", ex.getMessage() + " (" + name + ")", ex);
        }
        if (!(root.get("inputs") instanceof Map<?, ?>)) {
            throw new ConveyorCalcException("invalid_fixture", "Fixture " + name + " has no inputs map", Map.of("name", name));
        }
        return new Fixture(
            name,
            status,
            section(root, "inputs", name),
            section(root, "parameters", name),
            section(root, "expected_outputs", name),
            Tolerance.parse(root.get("tolerance")),
            fieldList(root, "expected_errors", name),
            fieldList(root, "expected_warnings", name)
        );
    }

    private static Map<String, Object> section(Map<String, Object> root, String key, String name) {
        var raw = root.get(key);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ConveyorCalcException("invalid_fixture", "Fixture " + name + ": " + key + " must be a map",
                Map.of("name", name, "section", key));
        }
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static List<String> fieldList(Map<String, Object> root, String key, String name) {
        var raw = root.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new ConveyorCalcException("invalid_fixture", "Fixture " + name + ": " + key + " must be a list",
                Map.of("name", name, "section", key));
        }
        return list.stream().map(String::valueOf).toList();
    }

    private static boolean isFixtureFile(Path path) {
        var file = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return file.endsWith(".yaml") || file.endsWith(".yml") || file.endsWith(".json");
    }

    private static boolean isJson(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static String defaultName(Path path) {
        var file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
