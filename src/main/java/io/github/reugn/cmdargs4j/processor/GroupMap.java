package io.github.reugn.cmdargs4j.processor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Arguments of one analyzed type, partitioned by group name.
 *
 * <p>Group names are matched ignoring case; the first spelling seen is kept for display.
 * The empty name is the default group used when there is no action member. Iteration
 * follows insertion order: seeded groups first, then groups created on demand.
 */
final class GroupMap {

    /**
     * Name of the group used when no action member exists.
     */
    static final String DEFAULT_GROUP = "";

    private final Map<String, Group> groups = new LinkedHashMap<>();

    /**
     * Adds an empty group known before classification starts.
     * Seeding a name that is already present is a no-op.
     *
     * @param name the group name
     */
    void seed(String name) {
        groups.putIfAbsent(key(name), new Group(name, true));
    }

    /**
     * Appends an argument to the named group, creating the group if needed.
     *
     * @param name     the group name
     * @param argument the argument to append
     */
    void append(String name, Argument argument) {
        groups.computeIfAbsent(key(name), k -> new Group(name, false)).arguments.add(argument);
    }

    /**
     * Appends an argument to every seeded group. Groups created on demand are left out,
     * so the result does not depend on where the argument is declared.
     *
     * @param argument the argument to append
     */
    void appendToSeeded(Argument argument) {
        for (Group group : groups.values()) {
            if (group.seeded) {
                group.arguments.add(argument);
            }
        }
    }

    /**
     * @param name the group name
     * @return {@code true} if the group was seeded rather than created on demand
     */
    boolean isSeeded(String name) {
        Group group = groups.get(key(name));
        return group != null && group.seeded;
    }

    /**
     * @param name the group name
     * @return the arguments of the group, or an empty list if there is no such group
     */
    List<Argument> arguments(String name) {
        Group group = groups.get(key(name));
        return group == null ? List.of() : Collections.unmodifiableList(group.arguments);
    }

    /**
     * @return the group names in iteration order, with their original spelling
     */
    List<String> names() {
        List<String> names = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {
            names.add(group.name);
        }
        return names;
    }

    Collection<Group> groups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    int size() {
        return groups.size();
    }

    boolean isEmpty() {
        return groups.isEmpty();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * A named, ordered list of arguments.
     */
    static final class Group {
        private final String name;
        private final boolean seeded;
        private final List<Argument> arguments = new ArrayList<>();

        private Group(String name, boolean seeded) {
            this.name = name;
            this.seeded = seeded;
        }

        String name() {
            return name;
        }

        List<Argument> arguments() {
            return Collections.unmodifiableList(arguments);
        }

        @Override
        public String toString() {
            return (name.isEmpty() ? "<default>" : name) + "(" + arguments.size() + ")";
        }
    }
}
