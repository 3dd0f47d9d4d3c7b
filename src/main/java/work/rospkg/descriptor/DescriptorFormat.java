package work.rospkg.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders package descriptors for humans and tools.
 */
public enum DescriptorFormat {
    JSON(new ObjectMapper().writerWithDefaultPrettyPrinter()),
    YAML(new ObjectMapper(new YAMLFactory()).writer());

    private final ObjectWriter writer;

    DescriptorFormat(ObjectWriter writer) {
        this.writer = writer;
    }

    public String render(PackageDescriptor descriptor) {
        return write(toSerializableMap(descriptor));
    }

    public String render(Collection<PackageDescriptor> descriptors) {
        List<Map<String, Object>> serializable = new ArrayList<>(descriptors.size());
        for (PackageDescriptor descriptor : descriptors) {
            serializable.add(toSerializableMap(descriptor));
        }
        return write(serializable);
    }

    public String write(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render " + name() + ": " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Plain map view of a descriptor; metadata values that are not plain data (such as the setup
     * options accessor) are left out.
     */
    public static Map<String, Object> toSerializableMap(PackageDescriptor descriptor) {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("path", descriptor.path().toString());
        serializable.put("type", descriptor.type());
        serializable.put("name", descriptor.name());
        Map<String, Object> dependencies = new LinkedHashMap<>();
        for (DependencyCategory category : DependencyCategory.values()) {
            List<Object> entries = new ArrayList<>();
            for (DependencyDescriptor dependency : descriptor.dependencies(category)) {
                if (dependency.metadata().isEmpty()) {
                    entries.add(dependency.name());
                } else {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", dependency.name());
                    entry.putAll(dependency.metadata());
                    entries.add(entry);
                }
            }
            dependencies.put(category.key(), entries);
        }
        serializable.put("dependencies", dependencies);
        Map<String, Object> metadata = new LinkedHashMap<>();
        descriptor.metadata().forEach((key, value) -> {
            if (isPlainData(value)) {
                metadata.put(key, value);
            }
        });
        serializable.put("metadata", metadata);
        return serializable;
    }

    private static boolean isPlainData(Object value) {
        return value == null
            || value instanceof String
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Map<?, ?>
            || value instanceof Collection<?>;
    }
}
