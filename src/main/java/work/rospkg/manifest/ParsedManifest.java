package work.rospkg.manifest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed view of a {@code package.xml} manifest as produced by a {@link ManifestParser}.
 *
 * <p>Instances are immutable; {@link #evaluateConditions(Map)} returns a copy whose conditional
 * declarations all carry an evaluated condition.
 */
public final class ParsedManifest {
    public static final String DEFAULT_BUILD_TYPE = "catkin";

    private final Path manifestPath;
    private final String name;
    private final String version;
    private final List<BuildTypeExport> buildTypes;
    private final List<ManifestDependency> buildDepends;
    private final List<ManifestDependency> buildtoolDepends;
    private final List<ManifestDependency> buildExportDepends;
    private final List<ManifestDependency> buildtoolExportDepends;
    private final List<ManifestDependency> execDepends;
    private final List<ManifestDependency> testDepends;
    private final List<GroupDependency> groupDepends;
    private final List<GroupMembership> memberOfGroups;

    private ParsedManifest(Builder builder) {
        this.manifestPath = builder.manifestPath;
        this.name = Objects.requireNonNull(builder.name, "name");
        this.version = builder.version;
        this.buildTypes = List.copyOf(builder.buildTypes);
        this.buildDepends = List.copyOf(builder.buildDepends);
        this.buildtoolDepends = List.copyOf(builder.buildtoolDepends);
        this.buildExportDepends = List.copyOf(builder.buildExportDepends);
        this.buildtoolExportDepends = List.copyOf(builder.buildtoolExportDepends);
        this.execDepends = List.copyOf(builder.execDepends);
        this.testDepends = List.copyOf(builder.testDepends);
        this.groupDepends = List.copyOf(builder.groupDepends);
        this.memberOfGroups = List.copyOf(builder.memberOfGroups);
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public Path manifestPath() {
        return manifestPath;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public List<BuildTypeExport> buildTypes() {
        return buildTypes;
    }

    public List<ManifestDependency> buildDepends() {
        return buildDepends;
    }

    public List<ManifestDependency> buildtoolDepends() {
        return buildtoolDepends;
    }

    public List<ManifestDependency> buildExportDepends() {
        return buildExportDepends;
    }

    public List<ManifestDependency> buildtoolExportDepends() {
        return buildtoolExportDepends;
    }

    public List<ManifestDependency> execDepends() {
        return execDepends;
    }

    public List<ManifestDependency> testDepends() {
        return testDepends;
    }

    public List<GroupDependency> groupDepends() {
        return groupDepends;
    }

    public List<GroupMembership> memberOfGroups() {
        return memberOfGroups;
    }

    /**
     * The single declared build type, {@value #DEFAULT_BUILD_TYPE} when none is declared. Exports whose
     * condition evaluated to {@code false} are ignored.
     *
     * @throws InvalidManifestException when more than one build type applies
     */
    public String buildType() throws InvalidManifestException {
        List<String> declared = new ArrayList<>();
        for (BuildTypeExport export : buildTypes) {
            if (!Boolean.FALSE.equals(export.evaluatedCondition())) {
                declared.add(export.buildType());
            }
        }
        if (declared.isEmpty()) {
            return DEFAULT_BUILD_TYPE;
        }
        if (declared.size() > 1) {
            throw new InvalidManifestException(
                "Only one <build_type> element is permitted, found " + declared, manifestPath);
        }
        return declared.get(0);
    }

    /**
     * Evaluates every condition of the manifest (dependencies, group dependencies, group memberships and
     * build type exports) against the given environment.
     *
     * @throws InvalidManifestException when a condition expression cannot be parsed
     */
    public ParsedManifest evaluateConditions(Map<String, String> environment) throws InvalidManifestException {
        Builder copy = toBuilder();
        try {
            copy.buildTypes = evaluate(buildTypes, BuildTypeExport::condition,
                (export, value) -> export.withEvaluatedCondition(value), environment);
            copy.buildDepends = evaluateDependencies(buildDepends, environment);
            copy.buildtoolDepends = evaluateDependencies(buildtoolDepends, environment);
            copy.buildExportDepends = evaluateDependencies(buildExportDepends, environment);
            copy.buildtoolExportDepends = evaluateDependencies(buildtoolExportDepends, environment);
            copy.execDepends = evaluateDependencies(execDepends, environment);
            copy.testDepends = evaluateDependencies(testDepends, environment);
            copy.groupDepends = evaluate(groupDepends, GroupDependency::condition,
                (group, value) -> group.withEvaluatedCondition(value), environment);
            copy.memberOfGroups = evaluate(memberOfGroups, GroupMembership::condition,
                (membership, value) -> membership.withEvaluatedCondition(value), environment);
        } catch (IllegalArgumentException ex) {
            throw new InvalidManifestException(
                "Package '" + name + "' has an invalid condition: " + ex.getMessage(), manifestPath, ex);
        }
        return copy.build();
    }

    public Builder toBuilder() {
        return new Builder()
            .manifestPath(manifestPath)
            .name(name)
            .version(version)
            .buildTypes(buildTypes)
            .buildDepends(buildDepends)
            .buildtoolDepends(buildtoolDepends)
            .buildExportDepends(buildExportDepends)
            .buildtoolExportDepends(buildtoolExportDepends)
            .execDepends(execDepends)
            .testDepends(testDepends)
            .groupDepends(groupDepends)
            .memberOfGroups(memberOfGroups);
    }

    @Override
    public String toString() {
        return "ParsedManifest{" + name + (version == null ? "" : " " + version) + "}";
    }

    private static List<ManifestDependency> evaluateDependencies(
        List<ManifestDependency> dependencies,
        Map<String, String> environment
    ) {
        return evaluate(dependencies, ManifestDependency::condition,
            (dependency, value) -> dependency.withEvaluatedCondition(value), environment);
    }

    private static <T> List<T> evaluate(
        List<T> items,
        Function<T, String> condition,
        Evaluated<T> apply,
        Map<String, String> environment
    ) {
        List<T> evaluated = new ArrayList<>(items.size());
        for (T item : items) {
            boolean value = ConditionExpression.evaluate(condition.apply(item), environment);
            evaluated.add(apply.with(item, value));
        }
        return evaluated;
    }

    @FunctionalInterface
    private interface Evaluated<T> {
        T with(T item, boolean value);
    }

    public static final class Builder {
        private Path manifestPath;
        private String name;
        private String version;
        private List<BuildTypeExport> buildTypes = List.of();
        private List<ManifestDependency> buildDepends = List.of();
        private List<ManifestDependency> buildtoolDepends = List.of();
        private List<ManifestDependency> buildExportDepends = List.of();
        private List<ManifestDependency> buildtoolExportDepends = List.of();
        private List<ManifestDependency> execDepends = List.of();
        private List<ManifestDependency> testDepends = List.of();
        private List<GroupDependency> groupDepends = List.of();
        private List<GroupMembership> memberOfGroups = List.of();

        public Builder manifestPath(Path manifestPath) {
            this.manifestPath = manifestPath;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder buildTypes(List<BuildTypeExport> buildTypes) {
            this.buildTypes = orEmpty(buildTypes);
            return this;
        }

        public Builder buildType(String buildType) {
            return buildTypes(List.of(BuildTypeExport.of(buildType)));
        }

        public Builder buildDepends(List<ManifestDependency> buildDepends) {
            this.buildDepends = orEmpty(buildDepends);
            return this;
        }

        public Builder buildtoolDepends(List<ManifestDependency> buildtoolDepends) {
            this.buildtoolDepends = orEmpty(buildtoolDepends);
            return this;
        }

        public Builder buildExportDepends(List<ManifestDependency> buildExportDepends) {
            this.buildExportDepends = orEmpty(buildExportDepends);
            return this;
        }

        public Builder buildtoolExportDepends(List<ManifestDependency> buildtoolExportDepends) {
            this.buildtoolExportDepends = orEmpty(buildtoolExportDepends);
            return this;
        }

        public Builder execDepends(List<ManifestDependency> execDepends) {
            this.execDepends = orEmpty(execDepends);
            return this;
        }

        public Builder testDepends(List<ManifestDependency> testDepends) {
            this.testDepends = orEmpty(testDepends);
            return this;
        }

        public Builder groupDepends(List<GroupDependency> groupDepends) {
            this.groupDepends = orEmpty(groupDepends);
            return this;
        }

        public Builder memberOfGroups(List<GroupMembership> memberOfGroups) {
            this.memberOfGroups = orEmpty(memberOfGroups);
            return this;
        }

        public ParsedManifest build() {
            return new ParsedManifest(this);
        }

        private static <T> List<T> orEmpty(List<T> values) {
            return values == null ? List.of() : values;
        }
    }
}
