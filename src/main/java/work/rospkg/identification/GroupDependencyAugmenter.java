package work.rospkg.identification;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rospkg.descriptor.DependencyCategory;
import work.rospkg.descriptor.DependencyDescriptor;
import work.rospkg.descriptor.PackageDescriptor;
import work.rospkg.manifest.GroupDependency;
import work.rospkg.manifest.ParsedManifest;

/**
 * Resolves {@code <group_depend>} declarations against the packages of a batch and adds the group
 * members as build and run dependencies.
 *
 * <p>Must run after every descriptor of the batch went through identification: only descriptors with a
 * cached manifest take part, and members are looked up among them only.
 */
public final class GroupDependencyAugmenter implements PackageAugmentation {
    private static final Logger LOG = LoggerFactory.getLogger(GroupDependencyAugmenter.class);

    private final ManifestCache cache;

    public GroupDependencyAugmenter(ManifestCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public void augment(Collection<PackageDescriptor> descriptors) {
        Map<ParsedManifest, PackageDescriptor> packages = new LinkedHashMap<>();
        for (PackageDescriptor descriptor : descriptors) {
            Optional<ParsedManifest> manifest = cache.lookup(descriptor.path())
                .flatMap(ManifestCache.CachedManifest::manifest);
            manifest.ifPresent(m -> packages.put(m, descriptor));
        }

        for (Map.Entry<ParsedManifest, PackageDescriptor> entry : packages.entrySet()) {
            ParsedManifest manifest = entry.getKey();
            PackageDescriptor descriptor = entry.getValue();
            for (GroupDependency group : manifest.groupDepends()) {
                if (group.evaluatedCondition() == null) {
                    throw new IllegalStateException(
                        "Group dependency '" + group.group() + "' of '" + descriptor.path() + "' has no evaluated condition");
                }
                if (!group.evaluatedCondition()) {
                    continue;
                }
                Set<String> members = group.extractGroupMembers(packages.keySet());
                LOG.debug("Group '{}' of '{}' resolved to {}", group.group(), manifest.name(), members);
                for (String member : members) {
                    descriptor.addDependency(DependencyCategory.BUILD, new DependencyDescriptor(member));
                    descriptor.addDependency(DependencyCategory.RUN, new DependencyDescriptor(member));
                }
            }
        }
    }
}
