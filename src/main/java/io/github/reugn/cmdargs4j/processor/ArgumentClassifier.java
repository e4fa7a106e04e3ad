package io.github.reugn.cmdargs4j.processor;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the markers of a single member into an {@link Argument} and its placement.
 *
 * <p>All markers of the member are inspected together:
 * <table border="1">
 *   <caption>Classification outcomes</caption>
 *   <tr><th>Markers present</th><th>Outcome</th></tr>
 *   <tr><td>required or optional, plus common</td><td>{@link Placement#COMMON}; group markers are ignored</td></tr>
 *   <tr><td>required or optional, plus group(s)</td><td>{@link Placement#GROUPS}</td></tr>
 *   <tr><td>required or optional only</td><td>{@link Placement#DEFAULT}</td></tr>
 *   <tr><td>common or group without an argument marker</td><td>{@link Placement#INVALID}</td></tr>
 *   <tr><td>none of the above</td><td>{@link Placement#NONE}</td></tr>
 * </table>
 *
 * <p>An argument marker with fewer than three readable parameters is treated as absent.
 * When a second argument marker is found after one was already resolved,
 * {@link Rule#ConflictingPropertyDeclaration} is reported and the first one is kept.
 */
final class ArgumentClassifier {

    private static final int MIN_PARAMETERS = 3;
    private static final int COLLECTION_INDEX = 3;

    private final DiagnosticSink sink;

    ArgumentClassifier(DiagnosticSink sink) {
        this.sink = sink;
    }

    /**
     * Where a classified member goes in the group map.
     */
    enum Placement {
        /** Appended to every group. */
        COMMON,
        /** Appended to each group named by a group marker. */
        GROUPS,
        /** Appended to the default group. */
        DEFAULT,
        /** Group-related markers without an argument marker. */
        INVALID,
        /** Not part of the schema. */
        NONE
    }

    /**
     * Result of classifying one member.
     *
     * @param argument  the resolved argument, {@code null} unless placement is COMMON, GROUPS or DEFAULT
     * @param placement where the argument goes
     * @param groups    group names from group markers, in declaration order
     */
    record Classification(Argument argument, Placement placement, List<String> groups) {
    }

    /**
     * Classifies a member.
     *
     * @param member the member to classify; must not be the action member
     * @return the classification, never {@code null}
     */
    Classification classify(Member member) {
        Argument argument = null;
        boolean common = false;
        List<String> groups = new ArrayList<>();

        for (Marker marker : member.markers()) {
            Argument candidate = null;
            if (marker instanceof Marker.Required required) {
                candidate = toRequired(member, required.parameters());
            } else if (marker instanceof Marker.Optional optional) {
                candidate = toOptional(member, optional.parameters());
            } else if (marker instanceof Marker.Common) {
                common = true;
            } else if (marker instanceof Marker.Group group) {
                groups.add(group.name());
            }

            if (candidate != null) {
                if (argument != null) {
                    sink.report(Rule.ConflictingPropertyDeclaration, member);
                } else {
                    argument = candidate;
                }
            }
        }

        if (argument == null) {
            Placement placement = common || !groups.isEmpty() ? Placement.INVALID : Placement.NONE;
            return new Classification(null, placement, List.copyOf(groups));
        }
        if (common) {
            return new Classification(argument, Placement.COMMON, List.of());
        }
        if (!groups.isEmpty()) {
            return new Classification(argument, Placement.GROUPS, List.copyOf(groups));
        }
        return new Classification(argument, Placement.DEFAULT, List.of());
    }

    // ==================== PARAMETER CONVERSION ====================

    private static Argument.Required toRequired(Member member, List<Object> parameters) {
        if (parameters.size() < MIN_PARAMETERS || !(parameters.get(0) instanceof Number position)) {
            return null;
        }
        return new Argument.Required(member, position.intValue(), stringAt(parameters, 1),
                stringAt(parameters, 2), collectionFlag(parameters));
    }

    private static Argument.Optional toOptional(Member member, List<Object> parameters) {
        if (parameters.size() < MIN_PARAMETERS) {
            return null;
        }
        return new Argument.Optional(member, parameters.get(0), stringAt(parameters, 1),
                stringAt(parameters, 2), collectionFlag(parameters));
    }

    private static String stringAt(List<Object> parameters, int index) {
        return parameters.get(index) instanceof String s ? s : null;
    }

    private static boolean collectionFlag(List<Object> parameters) {
        return parameters.size() > COLLECTION_INDEX && Boolean.TRUE.equals(parameters.get(COLLECTION_INDEX));
    }
}
