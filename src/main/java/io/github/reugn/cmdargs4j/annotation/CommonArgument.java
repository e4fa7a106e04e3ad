package io.github.reugn.cmdargs4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Shares an argument across every group defined by the {@link ActionArgument}.
 * <p>
 * Must be combined with {@link RequiredArgument} or {@link OptionalArgument}, and
 * only makes sense when the action field is an enum. Any {@link ArgumentGroup}
 * on the same field is ignored.
 *
 * <pre>
 * {@code
 * public class ToolArgs {
 *     @ActionArgument
 *     Mode mode;
 *
 *     @CommonArgument
 *     @OptionalArgument(name = "verbose")
 *     boolean verbose;
 * }
 * }
 * </pre>
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.CLASS)
public @interface CommonArgument {
}
