package io.github.reugn.cmdargs4j.processor;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Checks uniqueness invariants inside each group of a {@link GroupMap}.
 *
 * <p>Each group is validated on its own, walking arguments in stored order:
 * <ul>
 *   <li>Argument names must be unique, ignoring case, across required and optional arguments</li>
 *   <li>Positions of required arguments must be unique</li>
 * </ul>
 * A name or position is recorded even when it was a duplicate, so three arguments sharing
 * a name yield two reports, one per later occurrence. Arguments without a name take part
 * in the position check only.
 */
final class GroupValidator {

    private final DiagnosticSink sink;

    GroupValidator(DiagnosticSink sink) {
        this.sink = sink;
    }

    void validate(GroupMap groups) {
        for (GroupMap.Group group : groups.groups()) {
            validateGroup(group);
        }
    }

    private void validateGroup(GroupMap.Group group) {
        Set<String> names = new HashSet<>();
        Set<Integer> positions = new HashSet<>();

        for (Argument argument : group.arguments()) {
            if (argument instanceof Argument.Required required
                    && !positions.add(required.position())) {
                sink.report(Rule.DuplicatePositionalArgumentPosition, required.member(), required.position());
            }
            // an unreadable name was already rejected by javac
            if (argument.name() != null && !names.add(argument.name().toLowerCase(Locale.ROOT))) {
                sink.report(Rule.DuplicateArgumentName, argument.member(), argument.name());
            }
        }
    }
}
