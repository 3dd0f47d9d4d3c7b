package work.rospkg.identification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.rospkg.config.IdentificationSettings;
import work.rospkg.descriptor.DependencyCategory;
import work.rospkg.descriptor.DependencyDescriptor;
import work.rospkg.descriptor.PackageDescriptor;
import work.rospkg.manifest.BuildTypeExport;
import work.rospkg.manifest.ManifestDependency;
import work.rospkg.manifest.ParsedManifest;
import work.rospkg.setup.SetupOptionsAccessor;
import work.rospkg.support.InMemoryManifestParser;
import work.rospkg.support.LogCapture;

class PackageIdentifierTest {
    @TempDir
    Path workspace;

    private InMemoryManifestParser parser;
    private ManifestCache cache;
    private PackageIdentifier identifier;
    private AtomicInteger setupReads;

    @BeforeEach
    void setUp() {
        parser = new InMemoryManifestParser();
        cache = new ManifestCache(new PackageLoader(parser, () -> Map.of("ROS_VERSION", "2")), new BuildTypeClassifier());
        setupReads = new AtomicInteger();
        identifier = new PackageIdentifier(IdentificationSettings.defaults(), cache, (script, env) -> {
            setupReads.incrementAndGet();
            return Map.of("name", "demo_py", "python", env.getOrDefault("PYTHON", "none"));
        });
    }

    @Test
    void locationWithoutManifestIsLeftAlone() throws IOException {
        var dir = Files.createDirectories(workspace.resolve("empty"));
        var descriptor = new PackageDescriptor(dir);

        identifier.identify(descriptor);

        assertUnmodified(descriptor);
    }

    @Test
    void descriptorOfAnotherTypeIsLeftAlone() throws IOException {
        var dir = packageDir("claimed", ParsedManifest.builder("claimed").buildType("ament_cmake").build());
        var descriptor = new PackageDescriptor(dir);
        descriptor.setType("cmake");

        identifier.identify(descriptor);

        assertEquals("cmake", descriptor.type());
        assertEquals(0, parser.parseCount(dir));
    }

    @Test
    void ignoreMarkersSkipTheLocation() throws IOException {
        for (String marker : List.of("CATKIN_IGNORE", "AMENT_IGNORE")) {
            var dir = packageDir("ignored_" + marker, ParsedManifest.builder("ignored").buildType("ament_cmake").build());
            Files.createFile(dir.resolve(marker));
            var descriptor = new PackageDescriptor(dir);

            var skip = assertThrows(SkipLocationException.class, () -> identifier.identify(descriptor));

            assertEquals(SkipReason.IGNORE_MARKER, skip.reason());
            assertEquals(dir.toAbsolutePath().normalize(), skip.location());
            assertUnmodified(descriptor);
            assertEquals(0, parser.parseCount(dir));
        }
    }

    @Test
    void identifiesPackageFromManifest() throws IOException {
        var dir = packageDir("demo", ParsedManifest.builder("demo")
            .version("1.4.0")
            .buildType("ament_cmake")
            .buildDepends(List.of(ManifestDependency.of("rclcpp")))
            .buildtoolDepends(List.of(ManifestDependency.of("ament_cmake")))
            .buildExportDepends(List.of(ManifestDependency.of("std_msgs")))
            .buildtoolExportDepends(List.of(ManifestDependency.of("rosidl_default_runtime")))
            .execDepends(List.of(ManifestDependency.of("launch")))
            .testDepends(List.of(ManifestDependency.of("ament_lint_auto")))
            .build());
        var descriptor = new PackageDescriptor(dir);

        identifier.identify(descriptor);

        assertEquals("ros.ament_cmake", descriptor.type());
        assertEquals("demo", descriptor.name());
        assertEquals("1.4.0", descriptor.metadata().get(PackageDescriptor.METADATA_VERSION));
        assertEquals(Set.of("rclcpp", "ament_cmake"), descriptor.dependencyNames(DependencyCategory.BUILD));
        assertEquals(Set.of("std_msgs", "rosidl_default_runtime", "launch"), descriptor.dependencyNames(DependencyCategory.RUN));
        assertEquals(Set.of("ament_lint_auto"), descriptor.dependencyNames(DependencyCategory.TEST));
        assertTrue(descriptor.identifiesPackage());
    }

    @Test
    void descriptorTypedAsFamilyIsRefined() throws IOException {
        var dir = packageDir("family", ParsedManifest.builder("family").build());
        var descriptor = new PackageDescriptor(dir);
        descriptor.setType("ros");

        identifier.identify(descriptor);

        assertEquals("ros.catkin", descriptor.type());
    }

    @Test
    void dependenciesWithFalseConditionAreDropped() throws IOException {
        var dir = packageDir("conditional", ParsedManifest.builder("conditional")
            .buildType("ament_cmake")
            .buildDepends(List.of(ManifestDependency.conditional("rclcpp", "$ROS_VERSION == 2")))
            .execDepends(List.of(ManifestDependency.conditional("rospy", "$ROS_VERSION == 1")))
            .build());
        var descriptor = new PackageDescriptor(dir);

        identifier.identify(descriptor);

        assertEquals(Set.of("rclcpp"), descriptor.dependencyNames(DependencyCategory.BUILD));
        assertTrue(descriptor.dependencies(DependencyCategory.RUN).isEmpty());
    }

    @Test
    void versionBoundsBecomeDependencyMetadata() throws IOException {
        var dir = packageDir("versioned", ParsedManifest.builder("versioned")
            .buildType("ament_cmake")
            .buildDepends(List.of(ManifestDependency.of("rclcpp").withVersionGte("1.2")))
            .build());
        var descriptor = new PackageDescriptor(dir);

        identifier.identify(descriptor);

        DependencyDescriptor dependency = descriptor.dependencies(DependencyCategory.BUILD).iterator().next();
        assertEquals("rclcpp", dependency.name());
        assertEquals(Map.of("version_gte", "1.2"), dependency.metadata());
    }

    @Test
    void presetNameIsKept() throws IOException {
        var dir = packageDir("renamed", ParsedManifest.builder("manifest_name").buildType("ament_cmake").build());
        var descriptor = new PackageDescriptor(dir);
        descriptor.setName("configured_name");

        identifier.identify(descriptor);

        assertEquals("configured_name", descriptor.name());
        assertEquals("ros.ament_cmake", descriptor.type());
    }

    @Test
    void manifestIsParsedOnceForRepeatedIdentification() throws IOException {
        var dir = packageDir("cached", ParsedManifest.builder("cached")
            .buildType("ament_cmake")
            .buildDepends(List.of(ManifestDependency.of("rclcpp")))
            .build());
        var first = new PackageDescriptor(dir);
        var second = new PackageDescriptor(dir);

        identifier.identify(first);
        identifier.identify(second);

        assertEquals(1, parser.parseCount(dir));
        assertEquals(first.type(), second.type());
        assertEquals(first.name(), second.name());
        assertEquals(first.dependencyNames(), second.dependencyNames());
    }

    @Test
    void ambiguousBuildTypeLeavesDescriptorUnmodified() throws IOException {
        var dir = packageDir("ambiguous", ambiguousManifest());
        var descriptor = new PackageDescriptor(dir);

        try (var logs = LogCapture.of(BuildTypeClassifier.class)) {
            identifier.identify(descriptor);

            assertEquals(1, logs.events(Level.WARN).size());
            assertTrue(logs.messages(Level.WARN).get(0).contains("more than one build type"));
        }
        assertUnmodified(descriptor);
    }

    @Test
    void ambiguousBuildTypeWithLegacyManifestIsSkipped() throws IOException {
        var dir = packageDir("ambiguous_legacy", ambiguousManifest());
        Files.writeString(dir.resolve("manifest.xml"), "<package/>");
        var descriptor = new PackageDescriptor(dir);

        var skip = assertThrows(SkipLocationException.class, () -> identifier.identify(descriptor));

        assertEquals(SkipReason.LEGACY_MANIFEST, skip.reason());
        assertUnmodified(descriptor);
    }

    @Test
    void legacyManifestAloneIsSkipped() throws IOException {
        var dir = Files.createDirectories(workspace.resolve("dry"));
        Files.writeString(dir.resolve("manifest.xml"), "<package/>");

        var skip = assertThrows(SkipLocationException.class, () -> identifier.identify(new PackageDescriptor(dir)));

        assertEquals(SkipReason.LEGACY_MANIFEST, skip.reason());
    }

    @Test
    void invalidManifestIsNotAPackage() throws IOException {
        var dir = Files.createDirectories(workspace.resolve("broken"));
        parser.addInvalid(dir, "missing <name>");
        var descriptor = new PackageDescriptor(dir);

        identifier.identify(descriptor);

        assertUnmodified(descriptor);
    }

    @Test
    void pythonPackageWithoutSetupScriptIsSkipped() throws IOException {
        var dir = packageDir("no_setup", ParsedManifest.builder("no_setup").buildType("ament_python").build());
        var descriptor = new PackageDescriptor(dir);

        try (var logs = LogCapture.of(PackageIdentifier.class)) {
            var skip = assertThrows(SkipLocationException.class, () -> identifier.identify(descriptor));

            assertEquals(SkipReason.MISSING_SETUP_SCRIPT, skip.reason());
            assertEquals(1, logs.events(Level.ERROR).size());
            assertTrue(logs.messages(Level.ERROR).get(0).contains("ament_python"));
        }
        assertUnmodified(descriptor);
    }

    @Test
    void pythonPackageGetsLazySetupOptions() throws IOException {
        var dir = packageDir("demo_py", ParsedManifest.builder("demo_py").buildType("ament_python").build());
        Files.writeString(dir.resolve("setup.py"), "from setuptools import setup\nsetup(name='demo_py')\n");
        var descriptor = new PackageDescriptor(dir);

        identifier.identify(descriptor);

        assertEquals("ros.ament_python", descriptor.type());
        assertEquals(0, setupReads.get());
        var accessor = assertInstanceOf(SetupOptionsAccessor.class,
            descriptor.metadata().get(PackageDescriptor.METADATA_PYTHON_SETUP_OPTIONS));
        assertEquals(dir.resolve("setup.py").toAbsolutePath().normalize(), accessor.setupScript());

        assertEquals("3", accessor.evaluate(Map.of("PYTHON", "3")).get("python"));
        assertEquals("none", accessor.evaluate(Map.of()).get("python"));
        assertEquals(2, setupReads.get());
    }

    @Test
    void unevaluatedDependencyConditionIsAnError() throws IOException {
        var dir = Files.createDirectories(workspace.resolve("unevaluated"));
        var manifest = ParsedManifest.builder("unevaluated")
            .buildType("ament_cmake")
            .buildDepends(List.of(ManifestDependency.of("rclcpp")))
            .build();
        var unevaluatedCache = new ManifestCache(
            directory -> new ManifestCache.CachedManifest(Optional.of(manifest), Optional.of("ament_cmake")));
        var unevaluatedIdentifier = new PackageIdentifier(
            IdentificationSettings.defaults(), unevaluatedCache, (script, env) -> Map.of());

        var ex = assertThrows(IllegalStateException.class,
            () -> unevaluatedIdentifier.identify(new PackageDescriptor(dir)));

        assertTrue(ex.getMessage().contains("rclcpp"), ex.getMessage());
    }

    private Path packageDir(String name, ParsedManifest manifest) throws IOException {
        var dir = Files.createDirectories(workspace.resolve(name));
        parser.add(dir, manifest);
        return dir;
    }

    private static ParsedManifest ambiguousManifest() {
        return ParsedManifest.builder("ambiguous")
            .buildTypes(List.of(BuildTypeExport.of("ament_cmake"), BuildTypeExport.of("ament_python")))
            .build();
    }

    private static void assertUnmodified(PackageDescriptor descriptor) {
        assertNull(descriptor.type());
        assertNull(descriptor.name());
        assertTrue(descriptor.metadata().isEmpty());
        assertTrue(descriptor.dependencyNames().isEmpty());
    }
}
