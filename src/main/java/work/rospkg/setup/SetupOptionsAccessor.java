package work.rospkg.setup;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Deferred access to the setup options of an {@code ament_python} package.
 *
 * <p>Every call to {@link #evaluate(Map)} runs the script again; results are not cached because they
 * depend on the environment passed in.
 */
public final class SetupOptionsAccessor {
    private final Path setupScript;
    private final SetupOptionsReader reader;

    public SetupOptionsAccessor(Path setupScript, SetupOptionsReader reader) {
        this.setupScript = Objects.requireNonNull(setupScript, "setupScript");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public Path setupScript() {
        return setupScript;
    }

    public Map<String, Object> evaluate(Map<String, String> environment) {
        return reader.read(setupScript, environment == null ? Map.of() : environment);
    }

    @Override
    public String toString() {
        return "SetupOptionsAccessor{" + setupScript + "}";
    }
}
