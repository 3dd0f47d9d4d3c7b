package work.rospkg.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Names a dependency of a package, optionally with version constraint metadata.
 *
 * <p>Equality only considers the name: a dependency set keeps the metadata of the first entry added for a name.
 */
public final class DependencyDescriptor {
    private final String name;
    private final Map<String, Object> metadata;

    public DependencyDescriptor(String name) {
        this(name, Map.of());
    }

    public DependencyDescriptor(String name, Map<String, ?> metadata) {
        this.name = Objects.requireNonNull(name, "name");
        this.metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String name() {
        return name;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof DependencyDescriptor that && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
