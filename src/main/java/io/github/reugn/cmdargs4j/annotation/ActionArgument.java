package io.github.reugn.cmdargs4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the field that selects the active mode of a command line.
 * <p>
 * When the field is an enum, each constant defines one argument group, in declaration
 * order. Arguments are assigned to groups with {@link ArgumentGroup} or shared by all of
 * them with {@link CommonArgument}.
 * <p>
 * At most one field per class may carry this annotation.
 *
 * <pre>
 * {@code
 * public class GitArgs {
 *     enum Command { Clone, Pull }
 *
 *     @ActionArgument
 *     Command command;
 * }
 * }
 * </pre>
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.CLASS)
public @interface ActionArgument {
}
