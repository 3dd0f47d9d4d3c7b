package work.rospkg.setup;

import java.nio.file.Path;
import java.util.Map;

/**
 * Extracts the keyword arguments a {@code setup.py} script passes to {@code setup()}.
 */
@FunctionalInterface
public interface SetupOptionsReader {
    /**
     * @throws SetupOptionsException when the script cannot be evaluated
     */
    Map<String, Object> read(Path setupScript, Map<String, String> environment);
}
