package io.github.reugn.cmdargs4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.util.List;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.cmdargs4j.util.CompileHelper.compile;
import static io.github.reugn.cmdargs4j.util.CompileHelper.compileWithOptions;

/**
 * Tests for per-group uniqueness checks and processor options.
 */
@DisplayName("Group Validations")
class GroupValidationTest {

    private static final JavaFileObject SERVICE_WITH_TYPO = JavaFileObjects.forSourceString("test.Service",
            """
                    package test;

                    import io.github.reugn.cmdargs4j.annotation.ActionArgument;
                    import io.github.reugn.cmdargs4j.annotation.ArgumentGroup;
                    import io.github.reugn.cmdargs4j.annotation.RequiredArgument;

                    public class Service {
                        enum Command { Start, Stop }

                        @ActionArgument
                        Command command;

                        @ArgumentGroup("Strat")
                        @RequiredArgument(position = 0, name = "path")
                        String path;
                    }
                    """);

    @Nested
    @DisplayName("Uniqueness")
    class Uniqueness {

        @Test
        @DisplayName("Error when two required arguments share a position")
        void duplicatePosition() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Copy",
                    """
                            package test;

                            import io.github.reugn.cmdargs4j.annotation.RequiredArgument;

                            public class Copy {
                                @RequiredArgument(position = 0, name = "source")
                                String source;

                                @RequiredArgument(position = 0, name = "target")
                                String target;
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorCount(1);
            assertThat(compilation).hadErrorContaining(
                            "[DuplicatePositionalArgumentPosition] Position 0 is used by more than one")
                    .inFile(source)
                    .onLineContaining("String target;");
        }

        @Test
        @DisplayName("Error when required and optional arguments share a name ignoring case")
        void duplicateName() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Build",
                    """
                            package test;

                            import io.github.reugn.cmdargs4j.annotation.OptionalArgument;
                            import io.github.reugn.cmdargs4j.annotation.RequiredArgument;

                            public class Build {
                                @RequiredArgument(position = 0, name = "Output")
                                String target;

                                @OptionalArgument(defaultValue = "out", name = "output")
                                String output;
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorCount(1);
            assertThat(compilation).hadErrorContaining("[DuplicateArgumentName] Argument name 'output'")
                    .inFile(source)
                    .onLineContaining("String output;");
        }

        @Test
        @DisplayName("OK when the same position is used in different groups")
        void positionsPerGroup() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Service",
                    """
                            package test;

                            import io.github.reugn.cmdargs4j.annotation.ActionArgument;
                            import io.github.reugn.cmdargs4j.annotation.ArgumentGroup;
                            import io.github.reugn.cmdargs4j.annotation.RequiredArgument;

                            public class Service {
                                enum Command { Start, Stop }

                                @ActionArgument
                                Command command;

                                @ArgumentGroup("Start")
                                @RequiredArgument(position = 0, name = "path")
                                String path;

                                @ArgumentGroup("Stop")
                                @RequiredArgument(position = 0, name = "pid")
                                int pid;
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeededWithoutWarnings();
        }

        @Test
        @DisplayName("Error when a common argument clashes with a grouped one")
        void commonClash() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Service",
                    """
                            package test;

                            import io.github.reugn.cmdargs4j.annotation.ActionArgument;
                            import io.github.reugn.cmdargs4j.annotation.ArgumentGroup;
                            import io.github.reugn.cmdargs4j.annotation.CommonArgument;
                            import io.github.reugn.cmdargs4j.annotation.OptionalArgument;
                            import io.github.reugn.cmdargs4j.annotation.RequiredArgument;

                            public class Service {
                                enum Command { Start, Stop }

                                @ActionArgument
                                Command command;

                                @ArgumentGroup("Start")
                                @ArgumentGroup("Stop")
                                @RequiredArgument(position = 0, name = "name")
                                String service;

                                @CommonArgument
                                @OptionalArgument(name = "NAME")
                                String alias;
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("[DuplicateArgumentName] Argument name 'NAME'")
                    .inFile(source)
                    .onLineContaining("String alias;");
        }

        @Test
        @DisplayName("Error on record components sharing a position")
        void recordComponents() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Move",
                    """
                            package test;

                            import io.github.reugn.cmdargs4j.annotation.RequiredArgument;

                            public record Move(
                                    @RequiredArgument(position = 0, name = "from") String from,
                                    @RequiredArgument(position = 0, name = "to") String to) {
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorCount(1);
            assertThat(compilation).hadErrorContaining("[DuplicatePositionalArgumentPosition]");
        }
    }

    @Nested
    @DisplayName("Processor Options")
    class ProcessorOptions {

        @Test
        @DisplayName("Unknown group is accepted silently by default")
        void undeclaredGroupIgnored() {
            Compilation compilation = compile(SERVICE_WITH_TYPO);
            assertThat(compilation).succeededWithoutWarnings();
        }

        @Test
        @DisplayName("Warning with a suggestion when undeclaredGroups=warn")
        void undeclaredGroupWarn() {
            Compilation compilation = compileWithOptions(
                    List.of("-Acmdargs4j.undeclaredGroups=warn"), SERVICE_WITH_TYPO);
            assertThat(compilation).succeeded();
            assertThat(compilation).hadWarningContaining(
                            "[UndeclaredArgumentGroup] Group 'Strat' is not a value of the @ActionArgument field. "
                                    + "Did you mean 'Start'?")
                    .inFile(SERVICE_WITH_TYPO)
                    .onLineContaining("String path;");
        }

        @Test
        @DisplayName("Error when undeclaredGroups=error")
        void undeclaredGroupError() {
            Compilation compilation = compileWithOptions(
                    List.of("-Acmdargs4j.undeclaredGroups=error"), SERVICE_WITH_TYPO);
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("[UndeclaredArgumentGroup]");
        }

        @Test
        @DisplayName("Warnings become errors when warningsAsErrors is set")
        void warningsAsErrors() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Empty",
                    """
                            package test;

                            import io.github.reugn.cmdargs4j.annotation.ActionArgument;

                            public class Empty {
                                @ActionArgument
                                String command;
                            }
                            """);

            Compilation compilation = compileWithOptions(List.of("-Acmdargs4j.warningsAsErrors=true"), source);
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("[ActionWithoutArgumentsInGroup]");
        }

        @Test
        @DisplayName("Verbose mode prints the group summary")
        void verbose() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Service",
                    """
                            package test;

                            import io.github.reugn.cmdargs4j.annotation.ActionArgument;
                            import io.github.reugn.cmdargs4j.annotation.ArgumentGroup;
                            import io.github.reugn.cmdargs4j.annotation.CommonArgument;
                            import io.github.reugn.cmdargs4j.annotation.OptionalArgument;
                            import io.github.reugn.cmdargs4j.annotation.RequiredArgument;

                            public class Service {
                                enum Command { Start, Stop }

                                @ActionArgument
                                Command command;

                                @ArgumentGroup("Start")
                                @RequiredArgument(position = 0, name = "path")
                                String path;

                                @CommonArgument
                                @OptionalArgument(name = "verbose")
                                boolean verbose;
                            }
                            """);

            Compilation compilation = compileWithOptions(List.of("-Acmdargs4j.verbose"), source);
            assertThat(compilation).succeeded();
            assertThat(compilation).hadNoteContaining(
                    "Argument schema for test.Service: action=command, groups=[Start(2), Stop(1)]");
        }

        @Test
        @DisplayName("Warning for an invalid option value")
        void invalidOption() {
            Compilation compilation = compileWithOptions(
                    List.of("-Acmdargs4j.undeclaredGroups=sometimes"), SERVICE_WITH_TYPO);
            assertThat(compilation).succeeded();
            assertThat(compilation).hadWarningContaining("Invalid value 'sometimes' for -Acmdargs4j.undeclaredGroups");
        }
    }
}
