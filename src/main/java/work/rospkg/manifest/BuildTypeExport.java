package work.rospkg.manifest;

import java.util.Objects;

/**
 * A {@code <build_type>} element from the {@code <export>} section.
 */
public record BuildTypeExport(String buildType, String condition, Boolean evaluatedCondition) {
    public BuildTypeExport {
        Objects.requireNonNull(buildType, "buildType");
    }

    public static BuildTypeExport of(String buildType) {
        return new BuildTypeExport(buildType, null, null);
    }

    public static BuildTypeExport conditional(String buildType, String condition) {
        return new BuildTypeExport(buildType, condition, null);
    }

    public BuildTypeExport withEvaluatedCondition(boolean value) {
        return new BuildTypeExport(buildType, condition, value);
    }
}
