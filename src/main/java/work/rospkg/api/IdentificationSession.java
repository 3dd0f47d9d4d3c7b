package work.rospkg.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rospkg.config.IdentificationSettings;
import work.rospkg.descriptor.PackageDescriptor;
import work.rospkg.identification.BuildTypeClassifier;
import work.rospkg.identification.GroupDependencyAugmenter;
import work.rospkg.identification.ManifestCache;
import work.rospkg.identification.PackageIdentifier;
import work.rospkg.identification.PackageLoader;
import work.rospkg.identification.SkipLocationException;
import work.rospkg.identification.SkipReason;
import work.rospkg.manifest.ManifestParser;
import work.rospkg.setup.PythonSetupOptionsReader;
import work.rospkg.setup.SetupOptionsReader;

/**
 * Public entry point: one session per scan, owning the manifest cache shared by identification and
 * augmentation.
 */
public final class IdentificationSession {
    private static final Logger LOG = LoggerFactory.getLogger(IdentificationSession.class);

    private final IdentificationSettings settings;
    private final ManifestCache cache;
    private final PackageIdentifier identifier;
    private final GroupDependencyAugmenter augmenter;

    public IdentificationSession(ManifestParser parser) {
        this(IdentificationSettings.defaults(), parser);
    }

    public IdentificationSession(IdentificationSettings settings, ManifestParser parser) {
        this(settings, parser, System::getenv,
            new PythonSetupOptionsReader(settings.pythonExecutable(), settings.setupTimeout()));
    }

    public IdentificationSession(
        IdentificationSettings settings,
        ManifestParser parser,
        Supplier<Map<String, String>> environment,
        SetupOptionsReader setupOptionsReader
    ) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.cache = new ManifestCache(new PackageLoader(parser, environment), new BuildTypeClassifier());
        this.identifier = new PackageIdentifier(settings, cache, setupOptionsReader);
        this.augmenter = new GroupDependencyAugmenter(cache);
    }

    public IdentificationSettings settings() {
        return settings;
    }

    public ManifestCache cache() {
        return cache;
    }

    public PackageIdentifier identifier() {
        return identifier;
    }

    public GroupDependencyAugmenter augmenter() {
        return augmenter;
    }

    /**
     * @throws SkipLocationException when the location must be excluded from the scan
     */
    public void identify(PackageDescriptor descriptor) {
        identifier.identify(descriptor);
    }

    public void augment(Collection<PackageDescriptor> descriptors) {
        augmenter.augment(descriptors);
    }

    /**
     * Identifies every descriptor, then augments the claimed ones as one batch.
     */
    public BatchResult identifyAll(Collection<PackageDescriptor> descriptors) {
        List<PackageDescriptor> identified = new ArrayList<>();
        Map<Path, SkipReason> skipped = new LinkedHashMap<>();
        List<Path> unclaimed = new ArrayList<>();
        for (PackageDescriptor descriptor : descriptors) {
            try {
                identifier.identify(descriptor);
            } catch (SkipLocationException ex) {
                skipped.put(ex.location(), ex.reason());
                continue;
            }
            if (isClaimed(descriptor)) {
                identified.add(descriptor);
            } else {
                unclaimed.add(descriptor.path());
            }
        }
        augmenter.augment(identified);
        LOG.debug("Identified {} packages, skipped {} locations", identified.size(), skipped.size());
        return new BatchResult(identified, skipped, unclaimed);
    }

    public void clear() {
        cache.clear();
    }

    private boolean isClaimed(PackageDescriptor descriptor) {
        return descriptor.type() != null && descriptor.type().startsWith(settings.family() + ".");
    }
}
