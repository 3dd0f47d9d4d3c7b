package work.rospkg.manifest;

import java.nio.file.Path;

/**
 * Raised when a manifest exists but does not describe a valid package.
 */
public final class InvalidManifestException extends Exception {
    private final Path location;

    public InvalidManifestException(String message, Path location) {
        super(message);
        this.location = location;
    }

    public InvalidManifestException(String message, Path location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Manifest file or package directory the problem was found in, may be {@code null}.
     */
    public Path location() {
        return location;
    }
}
