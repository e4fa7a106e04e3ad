package io.github.reugn.cmdargs4j.processor;

/**
 * The reconstructed schema of one analyzed type.
 *
 * @param action the action member, or {@code null} when the type has none
 * @param groups arguments partitioned by group
 */
record ArgumentSchema(ActionMember action, GroupMap groups) {

    /**
     * One-line description used for verbose output, e.g.
     * {@code action=command, groups=[Start(2), Stop(1)]}.
     *
     * @return the summary
     */
    String summary() {
        return "action=" + (action == null ? "none" : action.member().name())
                + ", groups=" + groups.groups();
    }
}
