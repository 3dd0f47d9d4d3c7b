package work.rospkg.identification;

import java.util.Collection;
import work.rospkg.descriptor.PackageDescriptor;

/**
 * Post-pass over a complete batch of identified packages.
 */
@FunctionalInterface
public interface PackageAugmentation {
    void augment(Collection<PackageDescriptor> descriptors);
}
