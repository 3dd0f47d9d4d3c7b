package work.rospkg.identification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.rospkg.manifest.BuildTypeExport;
import work.rospkg.manifest.ParsedManifest;
import work.rospkg.support.InMemoryManifestParser;

class ManifestCacheTest {
    @TempDir
    Path workspace;

    @Test
    void loadsEachPathOnce() {
        var parser = new InMemoryManifestParser();
        var dir = workspace.resolve("demo");
        parser.add(dir, ParsedManifest.builder("demo").buildType("ament_cmake").build());
        var cache = cache(parser);

        var first = cache.lookupOrLoad(dir);
        var second = cache.lookupOrLoad(workspace.resolve("other").resolve("..").resolve("demo"));

        assertSame(first, second);
        assertEquals(1, parser.parseCount(dir));
        assertEquals("ament_cmake", first.buildType().orElseThrow());
        assertTrue(first.isPackage());
    }

    @Test
    void absenceIsCachedToo() {
        var parser = new InMemoryManifestParser();
        var dir = workspace.resolve("broken");
        parser.addInvalid(dir, "not a package");
        var cache = cache(parser);

        var first = cache.lookupOrLoad(dir);
        cache.lookupOrLoad(dir);

        assertFalse(first.manifest().isPresent());
        assertFalse(first.buildType().isPresent());
        assertEquals(1, parser.parseCount(dir));
        assertEquals(1, cache.size());
    }

    @Test
    void ambiguousBuildTypeKeepsTheManifest() {
        var parser = new InMemoryManifestParser();
        var dir = workspace.resolve("ambiguous");
        parser.add(dir, ParsedManifest.builder("ambiguous")
            .buildTypes(List.of(BuildTypeExport.of("ament_cmake"), BuildTypeExport.of("cmake")))
            .build());

        var entry = cache(parser).lookupOrLoad(dir);

        assertTrue(entry.manifest().isPresent());
        assertFalse(entry.buildType().isPresent());
        assertFalse(entry.isPackage());
    }

    @Test
    void lookupDoesNotLoad() {
        var parser = new InMemoryManifestParser();
        var dir = workspace.resolve("demo");
        parser.add(dir, ParsedManifest.builder("demo").build());
        var cache = cache(parser);

        assertTrue(cache.lookup(dir).isEmpty());
        assertEquals(0, parser.parseCount(dir));
    }

    @Test
    void clearForgetsEntries() {
        var parser = new InMemoryManifestParser();
        var dir = workspace.resolve("demo");
        parser.add(dir, ParsedManifest.builder("demo").build());
        var cache = cache(parser);

        cache.lookupOrLoad(dir);
        cache.clear();
        cache.lookupOrLoad(dir);

        assertEquals(2, parser.parseCount(dir));
    }

    @Test
    void concurrentLookupsParseOnce() {
        var parser = new InMemoryManifestParser();
        var dir = workspace.resolve("shared");
        parser.add(dir, ParsedManifest.builder("shared").build());
        var cache = cache(parser);
        var executor = Executors.newFixedThreadPool(8);
        try {
            var futures = IntStream.range(0, 32)
                .mapToObj(i -> CompletableFuture.supplyAsync(() -> cache.lookupOrLoad(dir), executor))
                .toList();
            futures.forEach(CompletableFuture::join);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, parser.parseCount(dir));
    }

    private static ManifestCache cache(InMemoryManifestParser parser) {
        return new ManifestCache(new PackageLoader(parser, Map::of), new BuildTypeClassifier());
    }
}
