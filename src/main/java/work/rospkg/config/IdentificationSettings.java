package work.rospkg.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;

/**
 * Immutable settings of a package identification session.
 */
public record IdentificationSettings(
    String family,
    List<String> ignoreMarkers,
    String legacyManifest,
    String pythonBuildType,
    String setupScript,
    String pythonExecutable,
    Duration setupTimeout
) {
    public static final String DEFAULT_FAMILY = "ros";
    public static final List<String> DEFAULT_IGNORE_MARKERS = List.of("CATKIN_IGNORE", "AMENT_IGNORE");
    public static final String DEFAULT_LEGACY_MANIFEST = "manifest.xml";
    public static final String DEFAULT_PYTHON_BUILD_TYPE = "ament_python";
    public static final String DEFAULT_SETUP_SCRIPT = "setup.py";
    public static final String DEFAULT_PYTHON_EXECUTABLE = "python3";
    public static final Duration DEFAULT_SETUP_TIMEOUT = Duration.ofSeconds(30);

    public IdentificationSettings {
        requireText(family, "family");
        Objects.requireNonNull(ignoreMarkers, "ignoreMarkers");
        ignoreMarkers = List.copyOf(ignoreMarkers);
        requireText(legacyManifest, "legacyManifest");
        requireText(pythonBuildType, "pythonBuildType");
        requireText(setupScript, "setupScript");
        requireText(pythonExecutable, "pythonExecutable");
        Objects.requireNonNull(setupTimeout, "setupTimeout");
        if (setupTimeout.isNegative() || setupTimeout.isZero()) {
            throw new IllegalArgumentException("setupTimeout must be positive: " + setupTimeout);
        }
    }

    public static IdentificationSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from a TOML file; keys that are absent keep their default value.
     *
     * <pre>
     * family = "ros"
     * ignore_markers = ["CATKIN_IGNORE", "AMENT_IGNORE"]
     * legacy_manifest = "manifest.xml"
     *
     * [python]
     * build_type = "ament_python"
     * setup_script = "setup.py"
     * executable = "python3"
     * timeout_seconds = 30
     * </pre>
     */
    public static IdentificationSettings load(Path file) throws IOException {
        TomlParseResult result = Toml.parse(Files.readString(file));
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(TomlParseError::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings file " + file + ": " + errors);
        }
        try {
            return fromToml(result);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid settings file " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static IdentificationSettings fromToml(TomlParseResult result) {
        Builder builder = builder();
        if (result.contains("family")) {
            builder.family(result.getString("family"));
        }
        if (result.contains("ignore_markers")) {
            builder.ignoreMarkers(readStringArray(result.getArray("ignore_markers")));
        }
        if (result.contains("legacy_manifest")) {
            builder.legacyManifest(result.getString("legacy_manifest"));
        }
        if (result.contains("python.build_type")) {
            builder.pythonBuildType(result.getString("python.build_type"));
        }
        if (result.contains("python.setup_script")) {
            builder.setupScript(result.getString("python.setup_script"));
        }
        if (result.contains("python.executable")) {
            builder.pythonExecutable(result.getString("python.executable"));
        }
        if (result.contains("python.timeout_seconds")) {
            builder.setupTimeout(Duration.ofSeconds(result.getLong("python.timeout_seconds")));
        }
        return builder.build();
    }

    private static List<String> readStringArray(TomlArray array) {
        if (array == null || array.isEmpty()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String value = array.getString(i);
            if (value != null && !value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    public static final class Builder {
        private String family = DEFAULT_FAMILY;
        private List<String> ignoreMarkers = DEFAULT_IGNORE_MARKERS;
        private String legacyManifest = DEFAULT_LEGACY_MANIFEST;
        private String pythonBuildType = DEFAULT_PYTHON_BUILD_TYPE;
        private String setupScript = DEFAULT_SETUP_SCRIPT;
        private String pythonExecutable = DEFAULT_PYTHON_EXECUTABLE;
        private Duration setupTimeout = DEFAULT_SETUP_TIMEOUT;

        public Builder family(String family) {
            this.family = family;
            return this;
        }

        public Builder ignoreMarkers(List<String> ignoreMarkers) {
            this.ignoreMarkers = ignoreMarkers;
            return this;
        }

        public Builder legacyManifest(String legacyManifest) {
            this.legacyManifest = legacyManifest;
            return this;
        }

        public Builder pythonBuildType(String pythonBuildType) {
            this.pythonBuildType = pythonBuildType;
            return this;
        }

        public Builder setupScript(String setupScript) {
            this.setupScript = setupScript;
            return this;
        }

        public Builder pythonExecutable(String pythonExecutable) {
            this.pythonExecutable = pythonExecutable;
            return this;
        }

        public Builder setupTimeout(Duration setupTimeout) {
            this.setupTimeout = setupTimeout;
            return this;
        }

        public IdentificationSettings build() {
            return new IdentificationSettings(
                family,
                ignoreMarkers,
                legacyManifest,
                pythonBuildType,
                setupScript,
                pythonExecutable,
                setupTimeout
            );
        }
    }
}
