package io.github.reugn.cmdargs4j.processor;

import io.github.reugn.cmdargs4j.processor.MemberFixtures.RecordingSink;
import io.github.reugn.cmdargs4j.processor.MemberFixtures.TestMember;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.github.reugn.cmdargs4j.processor.MemberFixtures.field;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Group Validator")
class GroupValidatorTest {

    private final RecordingSink sink = new RecordingSink();
    private final GroupValidator validator = new GroupValidator(sink);

    private static Argument.Required required(TestMember member, int position, String name) {
        return new Argument.Required(member, position, name, "", false);
    }

    private static Argument.Optional optional(TestMember member, String name) {
        return new Argument.Optional(member, null, name, "", false);
    }

    @Test
    @DisplayName("Two required arguments at position 0 yield one report on the second")
    void duplicatePosition() {
        TestMember first = field("first");
        TestMember second = field("second");
        GroupMap groups = new GroupMap();
        groups.append("", required(first, 0, "first"));
        groups.append("", required(second, 0, "second"));

        validator.validate(groups);

        assertThat(sink.reports()).singleElement().satisfies(report -> {
            assertThat(report.rule()).isEqualTo(Rule.DuplicatePositionalArgumentPosition);
            assertThat(report.member()).isSameAs(second);
            assertThat(report.args()).containsExactly(0);
        });
    }

    @Test
    @DisplayName("Names clash across required and optional arguments, ignoring case")
    void duplicateNameIgnoringCase() {
        TestMember out = field("out");
        TestMember output = field("output");
        GroupMap groups = new GroupMap();
        groups.append("", required(out, 0, "Output"));
        groups.append("", optional(output, "output"));

        validator.validate(groups);

        assertThat(sink.reports()).singleElement().satisfies(report -> {
            assertThat(report.rule()).isEqualTo(Rule.DuplicateArgumentName);
            assertThat(report.member()).isSameAs(output);
            assertThat(report.args()).containsExactly("output");
        });
    }

    @Test
    @DisplayName("Required argument reusing both name and position is reported twice")
    void duplicateNameAndPosition() {
        GroupMap groups = new GroupMap();
        groups.append("", required(field("a"), 1, "file"));
        groups.append("", required(field("b"), 1, "FILE"));

        validator.validate(groups);

        assertThat(sink.rules()).containsExactly(
                Rule.DuplicatePositionalArgumentPosition, Rule.DuplicateArgumentName);
    }

    @Test
    @DisplayName("Three arguments sharing a name yield one report per later occurrence")
    void pairwiseReports() {
        GroupMap groups = new GroupMap();
        groups.append("", optional(field("a"), "name"));
        groups.append("", optional(field("b"), "name"));
        groups.append("", optional(field("c"), "name"));

        validator.validate(groups);

        assertThat(sink.reportsOf(Rule.DuplicateArgumentName)).hasSize(2);
    }

    @Test
    @DisplayName("Same name and position in different groups is fine")
    void groupsAreIndependent() {
        GroupMap groups = new GroupMap();
        groups.seed("Start");
        groups.seed("Stop");
        groups.append("Start", required(field("a"), 0, "path"));
        groups.append("Stop", required(field("b"), 0, "path"));

        validator.validate(groups);

        assertThat(sink.reports()).isEmpty();
    }

    @Test
    @DisplayName("Common argument clashing in one group is reported once for that group")
    void commonClashInOneGroup() {
        TestMember verbose = field("verbose");
        GroupMap groups = new GroupMap();
        groups.seed("Start");
        groups.seed("Stop");
        groups.append("Start", optional(field("v"), "verbose"));
        groups.appendToSeeded(optional(verbose, "Verbose"));

        validator.validate(groups);

        assertThat(sink.reports()).singleElement().satisfies(report -> {
            assertThat(report.member()).isSameAs(verbose);
            assertThat(report.args()).containsExactly("Verbose");
        });
    }

    @Test
    @DisplayName("Arguments without a name are only checked for their position")
    void unnamedArguments() {
        TestMember second = field("second");
        GroupMap groups = new GroupMap();
        groups.append("", required(field("first"), 0, null));
        groups.append("", optional(field("other"), null));
        groups.append("", required(second, 0, null));

        validator.validate(groups);

        assertThat(sink.reports()).singleElement().satisfies(report -> {
            assertThat(report.rule()).isEqualTo(Rule.DuplicatePositionalArgumentPosition);
            assertThat(report.member()).isSameAs(second);
        });
    }

    @Test
    @DisplayName("Optional arguments do not occupy positions")
    void optionalHasNoPosition() {
        GroupMap groups = new GroupMap();
        groups.append("", optional(field("a"), "a"));
        groups.append("", required(field("b"), 0, "b"));
        groups.append("", required(field("c"), 1, "c"));

        validator.validate(groups);

        assertThat(sink.reports()).isEmpty();
    }
}
