package io.github.reugn.cmdargs4j.processor;

import javax.tools.Diagnostic;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Processor options, passed to javac as {@code -A<name>=<value>}.
 *
 * <table border="1">
 *   <caption>Supported options</caption>
 *   <tr><th>Option</th><th>Values</th><th>Default</th></tr>
 *   <tr><td>{@value #UNDECLARED_GROUPS}</td><td>{@code ignore}, {@code warn}, {@code error}</td><td>{@code ignore}</td></tr>
 *   <tr><td>{@value #WARNINGS_AS_ERRORS}</td><td>{@code true}, {@code false}</td><td>{@code false}</td></tr>
 *   <tr><td>{@value #VERBOSE}</td><td>{@code true}, {@code false}</td><td>{@code false}</td></tr>
 * </table>
 *
 * @param undeclaredGroups  how group names missing from the action enum are reported
 * @param warningsAsErrors  whether warnings are promoted to errors
 * @param verbose           whether a summary note is printed for each analyzed type
 */
record AnalyzerOptions(GroupCheck undeclaredGroups, boolean warningsAsErrors, boolean verbose) {

    static final String UNDECLARED_GROUPS = "cmdargs4j.undeclaredGroups";
    static final String WARNINGS_AS_ERRORS = "cmdargs4j.warningsAsErrors";
    static final String VERBOSE = "cmdargs4j.verbose";

    static final Set<String> NAMES = Set.of(UNDECLARED_GROUPS, WARNINGS_AS_ERRORS, VERBOSE);

    static final AnalyzerOptions DEFAULTS = new AnalyzerOptions(GroupCheck.IGNORE, false, false);

    /**
     * Reporting mode for {@link Rule#UndeclaredArgumentGroup}.
     */
    enum GroupCheck {
        IGNORE, WARN, ERROR
    }

    /**
     * Parses the processor options. Invalid values fall back to the default and are
     * passed to {@code warnings}.
     *
     * @param options  the raw options from the processing environment
     * @param warnings receives one message per invalid value
     * @return the parsed options
     */
    static AnalyzerOptions parse(Map<String, String> options, Consumer<String> warnings) {
        GroupCheck groupCheck = DEFAULTS.undeclaredGroups;
        String rawGroupCheck = options.get(UNDECLARED_GROUPS);
        if (rawGroupCheck != null) {
            try {
                groupCheck = GroupCheck.valueOf(rawGroupCheck.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                warnings.accept("Invalid value '" + rawGroupCheck + "' for -A" + UNDECLARED_GROUPS
                        + ". Expected one of: ignore, warn, error");
            }
        }
        return new AnalyzerOptions(groupCheck,
                parseFlag(options, WARNINGS_AS_ERRORS, DEFAULTS.warningsAsErrors, warnings),
                parseFlag(options, VERBOSE, DEFAULTS.verbose, warnings));
    }

    private static boolean parseFlag(Map<String, String> options, String name, boolean defaultValue,
                                     Consumer<String> warnings) {
        if (!options.containsKey(name)) {
            return defaultValue;
        }
        String raw = options.get(name);
        // javac maps a bare -Aname to null
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty() || value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        warnings.accept("Invalid value '" + raw + "' for -A" + name + ". Expected true or false");
        return defaultValue;
    }

    /**
     * Resolves the severity of a rule under these options.
     *
     * @param rule the rule being reported
     * @return the diagnostic kind to print
     */
    Diagnostic.Kind kindOf(Rule rule) {
        Diagnostic.Kind kind = rule.defaultKind();
        if (rule == Rule.UndeclaredArgumentGroup && undeclaredGroups == GroupCheck.ERROR) {
            kind = Diagnostic.Kind.ERROR;
        }
        if (warningsAsErrors && kind == Diagnostic.Kind.WARNING) {
            kind = Diagnostic.Kind.ERROR;
        }
        return kind;
    }
}
