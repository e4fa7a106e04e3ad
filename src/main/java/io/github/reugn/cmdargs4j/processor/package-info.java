/**
 * Annotation processor implementation for cmdargs4j.
 * <p>
 * This package contains the compile-time checker for classes annotated with
 * {@link io.github.reugn.cmdargs4j.annotation.RequiredArgument},
 * {@link io.github.reugn.cmdargs4j.annotation.OptionalArgument} and friends.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * ArgumentSchemaProcessor (entry point)
 *     ├── MetadataReader  - fields and markers from javax.lang.model
 *     └── SchemaAnalyzer  - entry gate, per type
 *             ├── SchemaBuilder       - action member, group universe, placement
 *             │       └── ArgumentClassifier
 *             └── GroupValidator      - name and position uniqueness per group
 *
 * Support types:
 *     ├── Member / Marker / Argument - analysis model, independent of javac
 *     ├── GroupMap                   - case-insensitive group partition
 *     ├── Rule / DiagnosticSink      - reported problems
 *     └── AnalyzerOptions            - -A processor options
 * </pre>
 *
 * @see io.github.reugn.cmdargs4j.annotation
 */
package io.github.reugn.cmdargs4j.processor;
