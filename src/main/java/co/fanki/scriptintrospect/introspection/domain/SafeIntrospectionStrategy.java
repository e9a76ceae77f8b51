package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Static introspection: metadata block, syntax analysis, dependency
 * resolution and CLI framework detection. Never executes the script.
 *
 * <p>Failures are all-or-nothing: if the analysis fails, or a later step
 * throws, the result is the fallback shape carrying one error.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SafeIntrospectionStrategy implements IntrospectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(
            SafeIntrospectionStrategy.class);

    private final InlineMetadataParser metadataParser;
    private final SyntaxAnalyzer syntaxAnalyzer;
    private final DependencyResolver dependencyResolver;
    private final CliFrameworkDetector cliFrameworkDetector;

    /**
     * Creates a new safe strategy.
     *
     * @param theMetadataParser reads the inline metadata block
     * @param theSyntaxAnalyzer extracts the script structure
     * @param theDependencyResolver merges dependency candidates
     * @param theCliFrameworkDetector detects the CLI framework
     */
    public SafeIntrospectionStrategy(
            final InlineMetadataParser theMetadataParser,
            final SyntaxAnalyzer theSyntaxAnalyzer,
            final DependencyResolver theDependencyResolver,
            final CliFrameworkDetector theCliFrameworkDetector) {
        this.metadataParser = Preconditions.requireNonNull(theMetadataParser,
                "Metadata parser is required");
        this.syntaxAnalyzer = Preconditions.requireNonNull(theSyntaxAnalyzer,
                "Syntax analyzer is required");
        this.dependencyResolver = Preconditions.requireNonNull(
                theDependencyResolver, "Dependency resolver is required");
        this.cliFrameworkDetector = Preconditions.requireNonNull(
                theCliFrameworkDetector, "CLI framework detector is required");
    }

    @Override
    public ScriptMetadata introspect(final ScriptSource source) {
        Preconditions.requireNonNull(source, "Script source is required");
        final String name = source.name();
        final String path = source.path().toString();

        final SyntaxAnalysis analysis = syntaxAnalyzer.analyze(source);
        if (analysis.isFailed()) {
            return ScriptMetadata.fallback(name, path,
                    List.of(analysis.error()));
        }

        try {
            final ScriptStructure structure = analysis.structure();
            final InlineMetadataBlock block = metadataParser.parse(
                    structure.text());
            final List<DependencyInfo> dependencies = dependencyResolver
                    .resolve(block, structure.imports());
            final CliFrameworkInfo cliFramework = cliFrameworkDetector
                    .detect(structure.imports());
            return new ScriptMetadata(name, path, structure.description(),
                    structure.docstring(), block, dependencies,
                    structure.entryPoints(), structure.functions(),
                    structure.classes(), structure.imports(), cliFramework,
                    List.of());
        } catch (final RuntimeException e) {
            LOG.warn("Introspection of {} failed", path, e);
            final String message = e.getMessage() != null ? e.getMessage()
                    : e.getClass().getSimpleName();
            return ScriptMetadata.fallback(name, path, List.of(
                    new ErrorRecord(ErrorKind.RUNTIME_ERROR,
                            "Introspection failed: " + message, null)));
        }
    }

}
