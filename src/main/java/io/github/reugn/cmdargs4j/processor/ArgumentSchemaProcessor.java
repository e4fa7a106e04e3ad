package io.github.reugn.cmdargs4j.processor;

import com.google.auto.service.AutoService;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compile-time checker for command-line argument classes.
 *
 * <p>Registered via {@link com.google.auto.service.AutoService}, so adding cmdargs4j to the
 * compile classpath is enough to enable it.
 *
 * <p><b>Processing Pipeline</b> (once per type declaring annotated fields):
 * <ol>
 *   <li><b>Read</b>: {@link MetadataReader} collects the fields and their argument annotations</li>
 *   <li><b>Build</b>: {@link SchemaBuilder} finds the {@code @ActionArgument}, seeds the groups
 *       and places every argument</li>
 *   <li><b>Validate</b>: {@link GroupValidator} checks name and position uniqueness per group</li>
 * </ol>
 *
 * <p><b>Example:</b>
 * <pre>
 * {@code
 * public class ServiceArgs {
 *     enum Command { Start, Stop }
 *
 *     @ActionArgument
 *     Command command;
 *
 *     @ArgumentGroup("Start")
 *     @RequiredArgument(position = 0, name = "path")
 *     String path;
 *
 *     @ArgumentGroup("Start")
 *     @RequiredArgument(position = 0, name = "port")   // error: position 0 already used in Start
 *     int port;
 * }
 * }
 * </pre>
 *
 * <p>Problems are reported through the {@link Messager} on the offending field and never
 * stop the analysis. See {@link Rule} for the full list and {@link AnalyzerOptions} for the
 * supported {@code -A} options.
 *
 * @see io.github.reugn.cmdargs4j.annotation
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("io.github.reugn.cmdargs4j.annotation.*")
public class ArgumentSchemaProcessor extends AbstractProcessor {

    private Messager messager;
    private MetadataReader metadataReader;
    private AnalyzerOptions options;

    /**
     * Creates a new processor. Required for {@link java.util.ServiceLoader} discovery; the
     * instance is usable once {@link #init(ProcessingEnvironment)} has been called.
     */
    public ArgumentSchemaProcessor() {
        // Required for ServiceLoader-based processor discovery
    }

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.messager = processingEnv.getMessager();
        this.metadataReader = new MetadataReader(processingEnv.getElementUtils());
        this.options = AnalyzerOptions.parse(processingEnv.getOptions(),
                message -> messager.printMessage(Diagnostic.Kind.WARNING, message));
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public Set<String> getSupportedOptions() {
        return AnalyzerOptions.NAMES;
    }

    /**
     * Analyzes every type that encloses an element annotated in this round.
     *
     * @param annotations the recognized annotation types present in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        SchemaAnalyzer analyzer = new SchemaAnalyzer(this::report, options);

        for (TypeElement type : collectTypes(annotations, roundEnv)) {
            List<Member> members = metadataReader.read(type);
            Optional<ArgumentSchema> schema = analyzer.analyze(members);
            if (options.verbose() && schema.isPresent()) {
                messager.printMessage(Diagnostic.Kind.NOTE,
                        "Argument schema for " + type.getQualifiedName() + ": " + schema.get().summary(), type);
            }
        }

        return true;
    }

    /**
     * Collects the enclosing types of all annotated elements, each once, in discovery order.
     */
    private static Set<TypeElement> collectTypes(Set<? extends TypeElement> annotations,
                                                 RoundEnvironment roundEnv) {
        Set<TypeElement> types = new LinkedHashSet<>();
        for (TypeElement annotation : annotations) {
            for (Element element : roundEnv.getElementsAnnotatedWith(annotation)) {
                if (element.getEnclosingElement() instanceof TypeElement type) {
                    types.add(type);
                }
            }
        }
        return types;
    }

    private void report(Rule rule, Member member, Object... args) {
        Element location = member instanceof ElementMember elementMember ? elementMember.element() : null;
        messager.printMessage(options.kindOf(rule), rule.format(args), location);
    }
}
