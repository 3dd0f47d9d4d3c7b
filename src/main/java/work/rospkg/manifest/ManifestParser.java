package work.rospkg.manifest;

import java.nio.file.Path;

/**
 * Adapter boundary to the component that reads {@code package.xml} files.
 *
 * <p>Implementations return manifests with unevaluated conditions; evaluation happens in the package loader.
 */
public interface ManifestParser {
    String MANIFEST_FILENAME = "package.xml";

    boolean manifestExistsAt(Path directory);

    /**
     * Parses the manifest of the given package directory.
     *
     * @throws InvalidManifestException when the content is not a valid manifest
     * @throws IllegalStateException when a validation assertion of the parser fails
     */
    ParsedManifest parse(Path directory) throws InvalidManifestException;
}
