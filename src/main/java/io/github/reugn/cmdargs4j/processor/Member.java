package io.github.reugn.cmdargs4j.processor;

import java.util.List;

/**
 * A declared field of an analyzed type, as seen by the schema checks.
 *
 * <p>The analysis never reaches into compiler internals on its own: members are produced by
 * {@link MetadataReader} from {@code javax.lang.model} elements, or built directly in memory.
 * Identity is used both as the diagnostic location and to recognize the action member.
 */
interface Member {

    /**
     * @return the simple name of the member
     */
    String name();

    /**
     * Recognized markers on this member, in declaration order. Annotations from other
     * packages are never included.
     *
     * @return the markers, possibly empty
     */
    List<Marker> markers();

    /**
     * @return {@code true} if the declared type of the member is an enum
     */
    boolean isEnumTyped();

    /**
     * Names of the enum constants of the member's type, in declaration order.
     *
     * @return the constant names, empty when {@link #isEnumTyped()} is {@code false}
     */
    List<String> enumConstants();
}
