package work.rospkg.identification;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import work.rospkg.manifest.ParsedManifest;

/**
 * Remembers the manifest and build type found for each package directory of a scan.
 *
 * <p>Every directory is loaded at most once, absent results included. Entries never expire, the
 * filesystem is assumed not to change while a scan runs.
 */
public final class ManifestCache {
    private final Map<Path, CachedManifest> entries = new ConcurrentHashMap<>();
    private final Function<Path, CachedManifest> source;

    public ManifestCache(PackageLoader loader, BuildTypeClassifier classifier) {
        this(loadWith(Objects.requireNonNull(loader, "loader"), Objects.requireNonNull(classifier, "classifier")));
    }

    ManifestCache(Function<Path, CachedManifest> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public CachedManifest lookupOrLoad(Path directory) {
        return entries.computeIfAbsent(normalize(directory), source);
    }

    /**
     * Returns the entry of a directory without loading it.
     */
    public Optional<CachedManifest> lookup(Path directory) {
        return Optional.ofNullable(entries.get(normalize(directory)));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private static Function<Path, CachedManifest> loadWith(PackageLoader loader, BuildTypeClassifier classifier) {
        return directory -> {
            Optional<ParsedManifest> manifest = loader.load(directory);
            Optional<String> buildType = manifest.flatMap(m -> classifier.classify(directory, m));
            return new CachedManifest(manifest, buildType);
        };
    }

    private static Path normalize(Path directory) {
        return Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    }

    public record CachedManifest(Optional<ParsedManifest> manifest, Optional<String> buildType) {
        public CachedManifest {
            Objects.requireNonNull(manifest, "manifest");
            Objects.requireNonNull(buildType, "buildType");
        }

        public boolean isPackage() {
            return manifest.isPresent() && buildType.isPresent();
        }
    }
}
