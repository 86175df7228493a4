package work.lcod.conveyor.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import picocli.CommandLine;
import work.lcod.conveyor.api.ModelInfo;

/**
 * Version banner: the build version stamped into {@code conveyor-calc.properties}, else the jar
 * manifest, else {@code development}, followed by the calculation model it runs.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String BUILD_PROPERTIES = "/conveyor-calc.properties";
    static final String DEVELOPMENT = "development";

    @Override
    public String[] getVersion() {
        String version = resolve(loadBuildProperties(), Main.class.getPackage().getImplementationVersion());
        return new String[] {
            "conveyor-calc " + version,
            "model " + ModelInfo.MODEL_KEY
        };
    }

    static String resolve(Properties build, String manifestVersion) {
        String stamped = build.getProperty("version");
        // an unfiltered resource still holds the ${project.version} placeholder
        if (stamped != null && !stamped.isBlank() && !stamped.contains("${")) {
            return stamped.trim();
        }
        return manifestVersion != null ? manifestVersion : DEVELOPMENT;
    }

    private static Properties loadBuildProperties() {
        var properties = new Properties();
        try (InputStream in = VersionProvider.class.getResourceAsStream(BUILD_PROPERTIES)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + BUILD_PROPERTIES, ex);
        }
        return properties;
    }
}
