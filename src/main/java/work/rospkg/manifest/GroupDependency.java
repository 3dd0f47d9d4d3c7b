package work.rospkg.manifest;

import java.util.Collection;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A {@code <group_depend>} declaration: depends on every package that declares membership of {@code group}.
 */
public record GroupDependency(String group, String condition, Boolean evaluatedCondition) {
    public GroupDependency {
        Objects.requireNonNull(group, "group");
    }

    public static GroupDependency of(String group) {
        return new GroupDependency(group, null, null);
    }

    public static GroupDependency conditional(String group, String condition) {
        return new GroupDependency(group, condition, null);
    }

    public GroupDependency withEvaluatedCondition(boolean value) {
        return new GroupDependency(group, condition, value);
    }

    /**
     * Names of the given manifests that are members of this group. Only the manifests passed in are
     * considered, packages outside of them never show up as members.
     */
    public SortedSet<String> extractGroupMembers(Collection<ParsedManifest> candidates) {
        SortedSet<String> members = new TreeSet<>();
        for (ParsedManifest candidate : candidates) {
            for (GroupMembership membership : candidate.memberOfGroups()) {
                if (membership.evaluatedCondition() == null) {
                    throw new IllegalStateException(
                        "Group membership '" + membership.group() + "' of package '" + candidate.name()
                            + "' has no evaluated condition");
                }
                if (membership.evaluatedCondition() && group.equals(membership.group())) {
                    members.add(candidate.name());
                }
            }
        }
        return members;
    }
}
