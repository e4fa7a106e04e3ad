package io.github.reugn.cmdargs4j.processor;

/**
 * A member resolved into a command-line argument.
 *
 * <p>The member is kept only as the diagnostic location.
 */
sealed interface Argument {

    Member member();

    String name();

    String description();

    boolean collection();

    /**
     * Positional argument built from {@code @RequiredArgument}.
     */
    record Required(Member member, int position, String name, String description, boolean collection)
            implements Argument {
    }

    /**
     * Named argument built from {@code @OptionalArgument}.
     */
    record Optional(Member member, Object defaultValue, String name, String description, boolean collection)
            implements Argument {
    }
}
