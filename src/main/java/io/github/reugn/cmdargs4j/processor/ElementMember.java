package io.github.reugn.cmdargs4j.processor;

import javax.lang.model.element.VariableElement;
import java.util.List;

/**
 * A {@link Member} backed by a field or enum constant of the compilation.
 *
 * @param element       the field or enum constant; also the location of every diagnostic on this member
 * @param markers       recognized markers in declaration order
 * @param isEnumTyped   whether the field's type is an enum
 * @param enumConstants the enum constant names, empty for other types
 */
record ElementMember(VariableElement element, List<Marker> markers, boolean isEnumTyped,
                     List<String> enumConstants) implements Member {

    ElementMember {
        markers = List.copyOf(markers);
        enumConstants = List.copyOf(enumConstants);
    }

    @Override
    public String name() {
        return element.getSimpleName().toString();
    }
}
