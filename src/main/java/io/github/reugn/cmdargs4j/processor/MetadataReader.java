package io.github.reugn.cmdargs4j.processor;

import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the members of a type and the argument annotations attached to them.
 *
 * <p>Only fields declared directly on the type are members, enum constants included;
 * inherited fields are not considered. Record components are covered through their
 * generated private fields.
 *
 * <p>Annotations are recognized by their package, {@value #ANNOTATION_PACKAGE}. Any other
 * annotation is skipped. Values are read with defaults applied, in the canonical order of
 * the annotation elements:
 * <table border="1">
 *   <caption>Marker parameter order</caption>
 *   <tr><th>Annotation</th><th>Parameters</th></tr>
 *   <tr><td>{@code @RequiredArgument}</td><td>position, name, description, collection</td></tr>
 *   <tr><td>{@code @OptionalArgument}</td><td>defaultValue, name, description, collection</td></tr>
 * </table>
 * Reading stops at the first element with no value, which happens when javac has already
 * rejected the annotation (e.g. a missing {@code name}).
 *
 * <p>No validation happens here.
 */
final class MetadataReader {

    static final String ANNOTATION_PACKAGE = "io.github.reugn.cmdargs4j.annotation";

    private static final List<String> REQUIRED_ELEMENTS = List.of("position", "name", "description", "collection");
    private static final List<String> OPTIONAL_ELEMENTS = List.of("defaultValue", "name", "description", "collection");

    private final Elements elementUtils;

    MetadataReader(Elements elementUtils) {
        this.elementUtils = elementUtils;
    }

    /**
     * Reads all fields and enum constants of the type, annotated or not, in declaration order.
     *
     * @param type the type to read
     * @return the members of the type
     */
    List<Member> read(TypeElement type) {
        List<Member> members = new ArrayList<>();
        for (Element enclosed : type.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.FIELD && enclosed.getKind() != ElementKind.ENUM_CONSTANT) {
                continue;
            }
            VariableElement field = (VariableElement) enclosed;
            List<String> constants = enumConstantsOf(field.asType());
            members.add(new ElementMember(field, readMarkers(field), constants != null,
                    constants == null ? List.of() : constants));
        }
        return members;
    }

    // ==================== MARKERS ====================

    private List<Marker> readMarkers(Element element) {
        List<Marker> markers = new ArrayList<>();
        for (AnnotationMirror mirror : element.getAnnotationMirrors()) {
            TypeElement annotationType = (TypeElement) mirror.getAnnotationType().asElement();
            if (!ANNOTATION_PACKAGE.equals(elementUtils.getPackageOf(annotationType).getQualifiedName().toString())) {
                continue;
            }
            switch (annotationType.getSimpleName().toString()) {
                case "RequiredArgument" -> markers.add(new Marker.Required(parameters(mirror, REQUIRED_ELEMENTS)));
                case "OptionalArgument" -> markers.add(new Marker.Optional(parameters(mirror, OPTIONAL_ELEMENTS)));
                case "CommonArgument" -> markers.add(new Marker.Common());
                case "ActionArgument" -> markers.add(new Marker.Action());
                case "ArgumentGroup" -> addGroup(markers, valueOf(mirror, "value"));
                case "ArgumentGroups" -> {
                    if (valueOf(mirror, "value") instanceof List<?> entries) {
                        for (Object entry : entries) {
                            if (entry instanceof AnnotationValue annotationValue
                                    && annotationValue.getValue() instanceof AnnotationMirror group) {
                                addGroup(markers, valueOf(group, "value"));
                            }
                        }
                    }
                }
                default -> {
                    // another annotation of the package, not a marker
                }
            }
        }
        return markers;
    }

    private static void addGroup(List<Marker> markers, Object name) {
        if (name instanceof String groupName) {
            markers.add(new Marker.Group(groupName));
        }
    }

    private List<Object> parameters(AnnotationMirror mirror, List<String> elementNames) {
        Map<String, Object> values = valuesWithDefaults(mirror);
        List<Object> parameters = new ArrayList<>(elementNames.size());
        for (String name : elementNames) {
            if (!values.containsKey(name)) {
                break;
            }
            parameters.add(values.get(name));
        }
        return parameters;
    }

    private Object valueOf(AnnotationMirror mirror, String elementName) {
        return valuesWithDefaults(mirror).get(elementName);
    }

    private Map<String, Object> valuesWithDefaults(AnnotationMirror mirror) {
        Map<String, Object> values = new HashMap<>();
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry
                : elementUtils.getElementValuesWithDefaults(mirror).entrySet()) {
            values.put(entry.getKey().getSimpleName().toString(), entry.getValue().getValue());
        }
        return values;
    }

    // ==================== TYPES ====================

    /**
     * Returns the constant names of an enum type, or {@code null} if the type is not an enum.
     */
    private static List<String> enumConstantsOf(TypeMirror type) {
        if (type.getKind() != TypeKind.DECLARED) {
            return null;
        }
        Element typeElement = ((DeclaredType) type).asElement();
        if (typeElement.getKind() != ElementKind.ENUM) {
            return null;
        }
        List<String> constants = new ArrayList<>();
        for (Element enclosed : typeElement.getEnclosedElements()) {
            if (enclosed.getKind() == ElementKind.ENUM_CONSTANT) {
                constants.add(enclosed.getSimpleName().toString());
            }
        }
        return constants;
    }
}
