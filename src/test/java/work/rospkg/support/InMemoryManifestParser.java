package work.rospkg.support;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import work.rospkg.manifest.InvalidManifestException;
import work.rospkg.manifest.ManifestParser;
import work.rospkg.manifest.ParsedManifest;

/**
 * Manifest parser backed by a map, counting how often each directory is parsed.
 */
public final class InMemoryManifestParser implements ManifestParser {
    private final Map<Path, Outcome> outcomes = new ConcurrentHashMap<>();
    private final Map<Path, AtomicInteger> parseCalls = new ConcurrentHashMap<>();

    public InMemoryManifestParser add(Path directory, ParsedManifest manifest) {
        outcomes.put(normalize(directory), dir -> manifest.toBuilder().manifestPath(dir.resolve(MANIFEST_FILENAME)).build());
        return this;
    }

    public InMemoryManifestParser addInvalid(Path directory, String message) {
        outcomes.put(normalize(directory), dir -> {
            throw new InvalidManifestException(message, dir.resolve(MANIFEST_FILENAME));
        });
        return this;
    }

    public InMemoryManifestParser addFailingAssertion(Path directory, String message) {
        outcomes.put(normalize(directory), dir -> {
            throw new IllegalStateException(message);
        });
        return this;
    }

    public int parseCount(Path directory) {
        AtomicInteger count = parseCalls.get(normalize(directory));
        return count == null ? 0 : count.get();
    }

    @Override
    public boolean manifestExistsAt(Path directory) {
        return outcomes.containsKey(normalize(directory));
    }

    @Override
    public ParsedManifest parse(Path directory) throws InvalidManifestException {
        Path key = normalize(directory);
        parseCalls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        Outcome outcome = outcomes.get(key);
        if (outcome == null) {
            throw new InvalidManifestException("No manifest", key);
        }
        return outcome.parse(key);
    }

    private static Path normalize(Path directory) {
        return directory.toAbsolutePath().normalize();
    }

    @FunctionalInterface
    private interface Outcome {
        ParsedManifest parse(Path directory) throws InvalidManifestException;
    }
}
