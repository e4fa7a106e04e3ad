package io.github.reugn.cmdargs4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a named argument that may be omitted on the command line.
 *
 * <pre>
 * {@code
 * public class CopyArgs {
 *     @OptionalArgument(defaultValue = "false", name = "verbose", description = "Print progress")
 *     boolean verbose;
 * }
 * }
 * </pre>
 * <p>
 * Names must be unique within each argument group, across both optional and
 * required arguments. Name comparison ignores case.
 *
 * @see RequiredArgument
 * @see CommonArgument
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.CLASS)
public @interface OptionalArgument {
    /**
     * Value used when the argument is absent, as written on the command line.
     * An empty string means no default.
     *
     * @return the default value
     */
    String defaultValue() default "";

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
