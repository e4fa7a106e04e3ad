package io.github.reugn.cmdargs4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a positional argument that must be supplied on the command line.
 * <p>
 * Positions are zero-based and must be unique within each argument group.
 *
 * <pre>
 * {@code
 * public class CopyArgs {
 *     @RequiredArgument(position = 0, name = "source", description = "File to copy")
 *     String source;
 *
 *     @RequiredArgument(position = 1, name = "target", description = "Destination")
 *     String target;
 * }
 * }
 * </pre>
 * <p>
 * A field cannot carry both {@code @RequiredArgument} and {@link OptionalArgument}.
 *
 * @see OptionalArgument
 * @see ArgumentGroup
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.CLASS)
public @interface RequiredArgument {
    /**
     * Zero-based position of the argument.
     *
     * @return the position
     */
    int position();

    /**
     * Name of the argument, compared case-insensitively.
     *
     * @return the argument name
     */
    String name();

    /**
     * Help text for the argument.
     *
     * @return the description
     */
    String description() default "";

    /**
     * Whether the argument collects several values.
     *
     * @return {@code true} for a collection argument
     */
    boolean collection() default false;
}
