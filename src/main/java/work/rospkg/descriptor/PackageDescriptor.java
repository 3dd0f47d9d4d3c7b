package work.rospkg.descriptor;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Describes a package found at a filesystem location.
 *
 * <p>Created by the caller with a path only, then filled in during identification and augmentation.
 */
public final class PackageDescriptor {
    public static final String METADATA_VERSION = "version";
    public static final String METADATA_PYTHON_SETUP_OPTIONS = "get_python_setup_options";

    private final Path path;
    private String type;
    private String name;
    private final Map<DependencyCategory, Set<DependencyDescriptor>> dependencies =
        new EnumMap<>(DependencyCategory.class);
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public PackageDescriptor(Path path) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        for (DependencyCategory category : DependencyCategory.values()) {
            dependencies.put(category, new LinkedHashSet<>());
        }
    }

    public Path path() {
        return path;
    }

    public String type() {
        return type;
    }

    /**
     * Sets the type; a type of a different family (the part before the first dot) cannot be replaced.
     */
    public void setType(String newType) {
        Objects.requireNonNull(newType, "type");
        if (type != null && !family(type).equals(family(newType))) {
            throw new IllegalStateException(
                "Package at '" + path + "' is already identified as '" + type + "', cannot change it to '" + newType + "'");
        }
        this.type = newType;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Set<DependencyDescriptor> dependencies(DependencyCategory category) {
        return dependencies.get(Objects.requireNonNull(category, "category"));
    }

    public Map<DependencyCategory, Set<DependencyDescriptor>> dependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    /**
     * Adds a dependency unless one with the same name is already present in the category.
     */
    public boolean addDependency(DependencyCategory category, DependencyDescriptor dependency) {
        return dependencies(category).add(Objects.requireNonNull(dependency, "dependency"));
    }

    /**
     * Names of the dependencies in the given categories, all categories when none are given.
     */
    public SortedSet<String> dependencyNames(DependencyCategory... categories) {
        DependencyCategory[] selected = categories == null || categories.length == 0
            ? DependencyCategory.values()
            : categories;
        SortedSet<String> names = new TreeSet<>();
        for (DependencyCategory category : selected) {
            for (DependencyDescriptor dependency : dependencies(category)) {
                names.add(dependency.name());
            }
        }
        return names;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public boolean identifiesPackage() {
        return type != null && name != null;
    }

    public static String family(String type) {
        int dot = type.indexOf('.');
        return dot < 0 ? type : type.substring(0, dot);
    }

    @Override
    public String toString() {
        return "PackageDescriptor{path=" + path + ", type=" + type + ", name=" + name + "}";
    }
}
