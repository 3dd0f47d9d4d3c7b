package work.rospkg.identification;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rospkg.config.IdentificationSettings;
import work.rospkg.descriptor.DependencyCategory;
import work.rospkg.descriptor.DependencyDescriptor;
import work.rospkg.descriptor.PackageDescriptor;
import work.rospkg.manifest.ManifestDependency;
import work.rospkg.manifest.ParsedManifest;
import work.rospkg.setup.SetupOptionsAccessor;
import work.rospkg.setup.SetupOptionsReader;

/**
 * Identifies ROS packages by their {@code package.xml} manifest.
 */
public final class PackageIdentifier implements PackageIdentification {
    private static final Logger LOG = LoggerFactory.getLogger(PackageIdentifier.class);

    private final IdentificationSettings settings;
    private final ManifestCache cache;
    private final SetupOptionsReader setupOptionsReader;

    public PackageIdentifier(IdentificationSettings settings, ManifestCache cache, SetupOptionsReader setupOptionsReader) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.setupOptionsReader = Objects.requireNonNull(setupOptionsReader, "setupOptionsReader");
    }

    @Override
    public void identify(PackageDescriptor descriptor) {
        Path path = descriptor.path();
        // already claimed by another kind of package
        if (descriptor.type() != null && !descriptor.type().equals(settings.family())) {
            return;
        }

        for (String marker : settings.ignoreMarkers()) {
            if (Files.exists(path.resolve(marker))) {
                LOG.debug("Skipping '{}' because of {}", path, marker);
                throw SkipLocationException.of(path, SkipReason.IGNORE_MARKER);
            }
        }

        ManifestCache.CachedManifest cached = cache.lookupOrLoad(path);
        if (!cached.isPackage()) {
            // a dry package must not be picked up as a plain CMake package
            if (Files.exists(path.resolve(settings.legacyManifest()))) {
                LOG.debug("Skipping '{}' because of {}", path, settings.legacyManifest());
                throw SkipLocationException.of(path, SkipReason.LEGACY_MANIFEST);
            }
            return;
        }
        ParsedManifest manifest = cached.manifest().orElseThrow();
        String buildType = cached.buildType().orElseThrow();

        boolean pythonPackage = settings.pythonBuildType().equals(buildType);
        Path setupScript = path.resolve(settings.setupScript());
        if (pythonPackage && !Files.isRegularFile(setupScript)) {
            LOG.error("ROS package '{}' with build type '{}' has no '{}' file", path, buildType, settings.setupScript());
            throw SkipLocationException.of(path, SkipReason.MISSING_SETUP_SCRIPT);
        }

        descriptor.setType(settings.family() + "." + buildType);

        // the name may come from external configuration
        if (descriptor.name() == null) {
            descriptor.setName(manifest.name());
        }

        descriptor.metadata().put(PackageDescriptor.METADATA_VERSION, manifest.version());

        addDependencies(descriptor, DependencyCategory.BUILD, manifest.buildDepends(), manifest.buildtoolDepends());
        addDependencies(descriptor, DependencyCategory.RUN,
            manifest.buildExportDepends(), manifest.buildtoolExportDepends(), manifest.execDepends());
        addDependencies(descriptor, DependencyCategory.TEST, manifest.testDepends());

        if (pythonPackage) {
            descriptor.metadata().put(
                PackageDescriptor.METADATA_PYTHON_SETUP_OPTIONS,
                new SetupOptionsAccessor(setupScript, setupOptionsReader));
        }
    }

    @SafeVarargs
    private static void addDependencies(
        PackageDescriptor descriptor,
        DependencyCategory category,
        List<ManifestDependency>... sources
    ) {
        for (List<ManifestDependency> source : sources) {
            for (ManifestDependency dependency : source) {
                if (dependency.evaluatedCondition() == null) {
                    throw new IllegalStateException(
                        "Dependency '" + dependency.name() + "' of '" + descriptor.path() + "' has no evaluated condition");
                }
                if (dependency.evaluatedCondition()) {
                    descriptor.addDependency(category, new DependencyDescriptor(dependency.name(), dependency.versionBounds()));
                }
            }
        }
    }
}
