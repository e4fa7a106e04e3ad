package io.github.reugn.cmdargs4j.processor;

import javax.tools.Diagnostic;

/**
 * Schema problems reported by the processor.
 *
 * <p>Every report is prefixed with the rule id, e.g.
 * <pre>
 * error: [DuplicateArgumentName] Argument name 'output' is used more than once in the same group
 * </pre>
 * The kind is the default severity; {@link AnalyzerOptions} may raise it.
 */
enum Rule {

    DuplicateActionArgument(Diagnostic.Kind.ERROR,
            "Only one field may be marked with @ActionArgument; the first one declared is used"),

    ActionWithoutArgumentsInGroup(Diagnostic.Kind.WARNING,
            "@ActionArgument is declared but no argument group was defined"),

    ConflictingPropertyDeclaration(Diagnostic.Kind.ERROR,
            "A field cannot be both @RequiredArgument and @OptionalArgument"),

    CannotSpecifyAGroupForANonProperty(Diagnostic.Kind.ERROR,
            "@CommonArgument and @ArgumentGroup require @RequiredArgument or @OptionalArgument on the same field"),

    CommonArgumentAttributeUsedWhenActionArgumentNotEnum(Diagnostic.Kind.WARNING,
            "@CommonArgument has no effect unless the @ActionArgument field is an enum"),

    DuplicateArgumentName(Diagnostic.Kind.ERROR,
            "Argument name '%s' is used more than once in the same group"),

    DuplicatePositionalArgumentPosition(Diagnostic.Kind.ERROR,
            "Position %s is used by more than one @RequiredArgument in the same group"),

    UndeclaredArgumentGroup(Diagnostic.Kind.WARNING,
            "Group '%s' is not a value of the @ActionArgument field%s");

    private final Diagnostic.Kind defaultKind;
    private final String messageFormat;

    Rule(Diagnostic.Kind defaultKind, String messageFormat) {
        this.defaultKind = defaultKind;
        this.messageFormat = messageFormat;
    }

    Diagnostic.Kind defaultKind() {
        return defaultKind;
    }

    /**
     * Formats the report text for this rule.
     *
     * @param args payload values, in the order the message expects them
     * @return the message, prefixed with the rule id
     */
    String format(Object... args) {
        return "[" + name() + "] " + String.format(messageFormat, args);
    }
}
