package io.github.reugn.cmdargs4j.processor;

import java.util.List;

/**
 * The member carrying {@code @ActionArgument}, with the group names it makes legal.
 *
 * @param member     the action member
 * @param groupNames enum constant names in declaration order; empty for a non-enum member
 */
record ActionMember(Member member, List<String> groupNames) {

    ActionMember {
        groupNames = List.copyOf(groupNames);
    }

    static ActionMember of(Member member) {
        return new ActionMember(member, member.isEnumTyped() ? member.enumConstants() : List.of());
    }

    boolean isEnum() {
        return member.isEnumTyped();
    }
}
