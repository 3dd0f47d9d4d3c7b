package work.rospkg.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.rospkg.descriptor.DescriptorFormat;
import work.rospkg.descriptor.PackageDescriptor;
import work.rospkg.identification.SkipReason;

/**
 * Outcome of identifying a batch of locations.
 *
 * @param identified descriptors claimed as packages, in input order
 * @param skipped locations excluded from the scan and why
 * @param unclaimed locations that are not packages of this kind
 */
public record BatchResult(List<PackageDescriptor> identified, Map<Path, SkipReason> skipped, List<Path> unclaimed) {
    public BatchResult {
        identified = List.copyOf(identified);
        skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
        unclaimed = List.copyOf(unclaimed);
    }

    public Optional<PackageDescriptor> find(String name) {
        return identified.stream().filter(d -> name.equals(d.name())).findFirst();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        List<Map<String, Object>> packages = new ArrayList<>();
        for (PackageDescriptor descriptor : identified) {
            packages.add(DescriptorFormat.toSerializableMap(descriptor));
        }
        serializable.put("packages", packages);
        Map<String, String> skippedPaths = new LinkedHashMap<>();
        skipped.forEach((path, reason) -> skippedPaths.put(path.toString(), reason.key()));
        serializable.put("skipped", skippedPaths);
        serializable.put("unclaimed", unclaimed.stream().map(Path::toString).toList());
        return serializable;
    }

    public String toPrettyJson() {
        return DescriptorFormat.JSON.write(toSerializableMap());
    }
}
