package io.github.reugn.cmdargs4j.processor;

import java.util.List;

/**
 * Builds the {@link ArgumentSchema} of a type from its members.
 *
 * <p>Construction runs in two phases so that common arguments always see the complete
 * set of declared groups:
 * <ol>
 *   <li><b>Universe</b>: find the action member and seed one empty group per enum
 *       constant, or the single default group when there is no action member</li>
 *   <li><b>Classification</b>: resolve every other member with {@link ArgumentClassifier}
 *       and place the resulting argument</li>
 * </ol>
 *
 * <p>Common arguments join the seeded groups only. Group names referenced by
 * {@code @ArgumentGroup} but not seeded in the first phase are created on demand, as is
 * the default group for ungrouped arguments next to an action member. They are reported as {@link Rule#UndeclaredArgumentGroup} only
 * when {@link AnalyzerOptions#undeclaredGroups()} asks for it.
 */
final class SchemaBuilder {

    private final DiagnosticSink sink;
    private final AnalyzerOptions options;
    private final ArgumentClassifier classifier;

    SchemaBuilder(DiagnosticSink sink, AnalyzerOptions options) {
        this.sink = sink;
        this.options = options;
        this.classifier = new ArgumentClassifier(sink);
    }

    /**
     * Builds the schema, reporting structural problems to the sink as they are found.
     *
     * @param members the members of the analyzed type, in declaration order
     * @return the schema, never {@code null}
     */
    ArgumentSchema build(List<Member> members) {
        ActionMember action = findAction(members);
        GroupMap groups = seedGroups(action);

        for (Member member : members) {
            if (member.markers().isEmpty() || (action != null && action.member() == member)) {
                continue;
            }
            place(member, classifier.classify(member), action, groups);
        }

        if (action != null && groups.isEmpty()) {
            sink.report(Rule.ActionWithoutArgumentsInGroup, action.member());
        }
        return new ArgumentSchema(action, groups);
    }

    // ==================== UNIVERSE ====================

    /**
     * Returns the first member marked as the action. Every later one is reported.
     */
    private ActionMember findAction(List<Member> members) {
        ActionMember action = null;
        for (Member member : members) {
            for (Marker marker : member.markers()) {
                if (!(marker instanceof Marker.Action)) {
                    continue;
                }
                if (action == null) {
                    action = ActionMember.of(member);
                } else {
                    sink.report(Rule.DuplicateActionArgument, member);
                }
            }
        }
        return action;
    }

    private static GroupMap seedGroups(ActionMember action) {
        GroupMap groups = new GroupMap();
        if (action == null) {
            groups.seed(GroupMap.DEFAULT_GROUP);
        } else {
            for (String name : action.groupNames()) {
                groups.seed(name);
            }
        }
        return groups;
    }

    // ==================== CLASSIFICATION ====================

    private void place(Member member, ArgumentClassifier.Classification classification,
                       ActionMember action, GroupMap groups) {
        Argument argument = classification.argument();
        switch (classification.placement()) {
            case INVALID -> sink.report(Rule.CannotSpecifyAGroupForANonProperty, member);
            case COMMON -> {
                groups.appendToSeeded(argument);
                if (action != null && !action.isEnum()) {
                    sink.report(Rule.CommonArgumentAttributeUsedWhenActionArgumentNotEnum, member);
                }
            }
            case GROUPS -> {
                for (String name : classification.groups()) {
                    checkDeclared(member, name, action, groups);
                    groups.append(name, argument);
                }
            }
            case DEFAULT -> groups.append(GroupMap.DEFAULT_GROUP, argument);
            case NONE -> {
                // not part of the schema
            }
        }
    }

    private void checkDeclared(Member member, String name, ActionMember action, GroupMap groups) {
        if (options.undeclaredGroups() == AnalyzerOptions.GroupCheck.IGNORE || groups.isSeeded(name)) {
            return;
        }
        List<String> declared = action == null ? List.of() : action.groupNames();
        sink.report(Rule.UndeclaredArgumentGroup, member, name, Suggestions.hint(name, declared));
    }
}
