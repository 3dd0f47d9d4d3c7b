package work.rospkg.descriptor;

import java.util.Locale;

/**
 * Dependency categories tracked per package.
 */
public enum DependencyCategory {
    BUILD,
    RUN,
    TEST;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
