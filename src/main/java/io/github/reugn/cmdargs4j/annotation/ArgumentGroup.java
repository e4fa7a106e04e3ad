package io.github.reugn.cmdargs4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Places an argument in the group selected by one action value.
 * <p>
 * The group name matches an enum constant of the {@link ActionArgument} field, ignoring
 * case. Repeat the annotation to place the argument in several groups:
 *
 * <pre>
 * {@code
 * public class ServiceArgs {
 *     @ActionArgument
 *     Command command;   // enum Command { Start, Stop, Status }
 *
 *     @ArgumentGroup("Start")
 *     @ArgumentGroup("Stop")
 *     @RequiredArgument(position = 0, name = "service")
 *     String service;
 * }
 * }
 * </pre>
 * <p>
 * Names that are not constants of the action enum create a new group. Set the
 * {@code -Acmdargs4j.undeclaredGroups=warn} compiler option to be told about them.
 *
 * @see ArgumentGroups
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.CLASS)
@Repeatable(ArgumentGroups.class)
public @interface ArgumentGroup {
    /**
     * Name of the group.
     *
     * @return the group name
     */
    String value();
}
