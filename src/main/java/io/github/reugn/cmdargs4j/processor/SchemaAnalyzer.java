package io.github.reugn.cmdargs4j.processor;

import java.util.List;
import java.util.Optional;

/**
 * Runs the schema checks for one type: entry gate, {@link SchemaBuilder}, then
 * {@link GroupValidator}.
 *
 * <p>All working state is created per call, so one analyzer may be used for any number of
 * types. Diagnostics reach the sink in member declaration order.
 */
final class SchemaAnalyzer {

    private final DiagnosticSink sink;
    private final AnalyzerOptions options;

    SchemaAnalyzer(DiagnosticSink sink, AnalyzerOptions options) {
        this.sink = sink;
        this.options = options;
    }

    /**
     * Analyzes the members of one type.
     *
     * @param members the members in declaration order
     * @return the schema, or empty when no member carries a recognized annotation
     */
    Optional<ArgumentSchema> analyze(List<Member> members) {
        if (!hasMarkers(members)) {
            return Optional.empty();
        }
        ArgumentSchema schema = new SchemaBuilder(sink, options).build(members);
        new GroupValidator(sink).validate(schema.groups());
        return Optional.of(schema);
    }

    static boolean hasMarkers(List<Member> members) {
        for (Member member : members) {
            if (!member.markers().isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
