package work.rospkg.identification;

import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rospkg.manifest.InvalidManifestException;
import work.rospkg.manifest.ParsedManifest;

/**
 * Derives the build type of a package, or nothing when the manifest declares several.
 */
public final class BuildTypeClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(BuildTypeClassifier.class);

    public Optional<String> classify(Path directory, ParsedManifest manifest) {
        try {
            return Optional.of(manifest.buildType());
        } catch (InvalidManifestException ex) {
            LOG.warn("ROS package '{}' in '{}' has more than one build type", manifest.name(), directory);
            return Optional.empty();
        }
    }
}
