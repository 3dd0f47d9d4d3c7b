package work.rospkg.identification;

import work.rospkg.descriptor.PackageDescriptor;

/**
 * Claims a location as a package by filling in its descriptor.
 */
@FunctionalInterface
public interface PackageIdentification {
    /**
     * Leaves the descriptor untouched when the location is not a package of this kind.
     *
     * @throws SkipLocationException when the location must be excluded altogether
     */
    void identify(PackageDescriptor descriptor);
}
