package work.rospkg.identification;

import java.nio.file.Path;

/**
 * Signals that a location must not be claimed by any identification, and not be searched further.
 * Not an error: callers advance the scan past the location.
 */
public final class SkipLocationException extends RuntimeException {
    private final Path location;
    private final SkipReason reason;

    private SkipLocationException(Path location, SkipReason reason) {
        super(reason.name() + ": " + location, null, false, false);
        this.location = location;
        this.reason = reason;
    }

    public static SkipLocationException of(Path location, SkipReason reason) {
        return new SkipLocationException(location, reason);
    }

    public Path location() {
        return location;
    }

    public SkipReason reason() {
        return reason;
    }
}
