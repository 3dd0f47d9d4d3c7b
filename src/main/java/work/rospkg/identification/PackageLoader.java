package work.rospkg.identification;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rospkg.manifest.InvalidManifestException;
import work.rospkg.manifest.ManifestParser;
import work.rospkg.manifest.ParsedManifest;

/**
 * Reads the manifest of a package directory and evaluates its conditions.
 *
 * <p>An invalid manifest yields no package instead of an error so a single broken manifest does not
 * abort a workspace scan.
 */
public final class PackageLoader {
    private static final Logger LOG = LoggerFactory.getLogger(PackageLoader.class);

    private final ManifestParser parser;
    private final Supplier<Map<String, String>> environment;

    public PackageLoader(ManifestParser parser) {
        this(parser, System::getenv);
    }

    public PackageLoader(ManifestParser parser, Supplier<Map<String, String>> environment) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public Optional<ParsedManifest> load(Path directory) {
        if (!parser.manifestExistsAt(directory)) {
            return Optional.empty();
        }
        ParsedManifest manifest;
        try {
            manifest = parser.parse(directory);
        } catch (InvalidManifestException | IllegalStateException ex) {
            LOG.debug("Ignoring invalid manifest in '{}': {}", directory, ex.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(manifest.evaluateConditions(environment.get()));
        } catch (InvalidManifestException ex) {
            LOG.debug("Ignoring manifest in '{}' with unusable conditions: {}", directory, ex.getMessage());
            return Optional.empty();
        }
    }
}
