package work.rospkg.manifest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single {@code *_depend} entry of a manifest.
 *
 * <p>{@code evaluatedCondition} stays {@code null} until the manifest conditions have been evaluated.
 */
public record ManifestDependency(
    String name,
    String condition,
    Boolean evaluatedCondition,
    String versionLte,
    String versionLt,
    String versionGte,
    String versionGt,
    String versionEq
) {
    public static final String VERSION_LTE = "version_lte";
    public static final String VERSION_LT = "version_lt";
    public static final String VERSION_GTE = "version_gte";
    public static final String VERSION_GT = "version_gt";
    public static final String VERSION_EQ = "version_eq";

    public ManifestDependency {
        Objects.requireNonNull(name, "name");
    }

    public static ManifestDependency of(String name) {
        return new ManifestDependency(name, null, null, null, null, null, null, null);
    }

    public static ManifestDependency conditional(String name, String condition) {
        return new ManifestDependency(name, condition, null, null, null, null, null, null);
    }

    public ManifestDependency withCondition(String newCondition) {
        return new ManifestDependency(name, newCondition, null, versionLte, versionLt, versionGte, versionGt, versionEq);
    }

    public ManifestDependency withEvaluatedCondition(boolean value) {
        return new ManifestDependency(name, condition, value, versionLte, versionLt, versionGte, versionGt, versionEq);
    }

    public ManifestDependency withVersionLte(String value) {
        return new ManifestDependency(name, condition, evaluatedCondition, value, versionLt, versionGte, versionGt, versionEq);
    }

    public ManifestDependency withVersionLt(String value) {
        return new ManifestDependency(name, condition, evaluatedCondition, versionLte, value, versionGte, versionGt, versionEq);
    }

    public ManifestDependency withVersionGte(String value) {
        return new ManifestDependency(name, condition, evaluatedCondition, versionLte, versionLt, value, versionGt, versionEq);
    }

    public ManifestDependency withVersionGt(String value) {
        return new ManifestDependency(name, condition, evaluatedCondition, versionLte, versionLt, versionGte, value, versionEq);
    }

    public ManifestDependency withVersionEq(String value) {
        return new ManifestDependency(name, condition, evaluatedCondition, versionLte, versionLt, versionGte, versionGt, value);
    }

    /**
     * Version bounds keyed by their attribute name; unset bounds are left out.
     */
    public Map<String, String> versionBounds() {
        Map<String, String> bounds = new LinkedHashMap<>();
        putIfPresent(bounds, VERSION_LTE, versionLte);
        putIfPresent(bounds, VERSION_LT, versionLt);
        putIfPresent(bounds, VERSION_GTE, versionGte);
        putIfPresent(bounds, VERSION_GT, versionGt);
        putIfPresent(bounds, VERSION_EQ, versionEq);
        return bounds;
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
