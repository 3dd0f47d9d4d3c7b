package work.rospkg.manifest;

import java.util.Objects;

/**
 * A {@code <member_of_group>} declaration.
 */
public record GroupMembership(String group, String condition, Boolean evaluatedCondition) {
    public GroupMembership {
        Objects.requireNonNull(group, "group");
    }

    public static GroupMembership of(String group) {
        return new GroupMembership(group, null, null);
    }

    public static GroupMembership conditional(String group, String condition) {
        return new GroupMembership(group, condition, null);
    }

    public GroupMembership withEvaluatedCondition(boolean value) {
        return new GroupMembership(group, condition, value);
    }
}
