package co.fanki.scriptintrospect.config;

import co.fanki.scriptintrospect.introspection.domain.CliFrameworkDetector;
import co.fanki.scriptintrospect.introspection.domain.ContentHasher;
import co.fanki.scriptintrospect.introspection.domain.DependencyResolver;
import co.fanki.scriptintrospect.introspection.domain.ImportEnhancer;
import co.fanki.scriptintrospect.introspection.domain.ImportIntrospectionStrategy;
import co.fanki.scriptintrospect.introspection.domain.InlineMetadataParser;
import co.fanki.scriptintrospect.introspection.domain.PassThroughImportEnhancer;
import co.fanki.scriptintrospect.introspection.domain.ResultWriter;
import co.fanki.scriptintrospect.introspection.domain.SafeIntrospectionStrategy;
import co.fanki.scriptintrospect.introspection.domain.ScriptIntrospector;
import co.fanki.scriptintrospect.introspection.domain.SyntaxAnalyzer;
import co.fanki.scriptintrospect.introspection.domain.python.PythonAstEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.List;

/**
 * Wires the introspection engine.
 *
 * <p>One instance of each component serves every invocation; the
 * Python engine holds the only state, its polyglot context. The import
 * tier gets its own enhancer bean so a dynamic analysis step can replace
 * the pass-through one without touching the safe tier.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class IntrospectorConfiguration {

    /**
     * Creates the GraalPy engine that parses scripts. Spring closes it
     * on shutdown.
     *
     * @return the Python engine
     * @throws IOException if the analyzer script cannot be loaded
     */
    @Bean
    public PythonAstEngine pythonAstEngine() throws IOException {
        return new PythonAstEngine();
    }

    /**
     * Creates the syntax analyzer.
     *
     * @param commandDecorators dotted decorator names that mark a command
     * @param pythonAstEngine the Python engine
     * @return the syntax analyzer
     */
    @Bean
    public SyntaxAnalyzer syntaxAnalyzer(
            @Value("${introspector.cli.command-decorators:click.command}")
            final List<String> commandDecorators,
            final PythonAstEngine pythonAstEngine) {
        return new SyntaxAnalyzer(commandDecorators, pythonAstEngine);
    }

    @Bean
    public InlineMetadataParser inlineMetadataParser() {
        return new InlineMetadataParser();
    }

    @Bean
    public DependencyResolver dependencyResolver() {
        return new DependencyResolver();
    }

    @Bean
    public CliFrameworkDetector cliFrameworkDetector() {
        return new CliFrameworkDetector();
    }

    @Bean
    public ContentHasher contentHasher() {
        return new ContentHasher();
    }

    /**
     * Creates the strategy that never executes the script.
     *
     * @param metadataParser the inline metadata parser
     * @param syntaxAnalyzer the syntax analyzer
     * @param dependencyResolver the dependency resolver
     * @param cliFrameworkDetector the CLI framework detector
     * @return the safe strategy
     */
    @Bean
    public SafeIntrospectionStrategy safeIntrospectionStrategy(
            final InlineMetadataParser metadataParser,
            final SyntaxAnalyzer syntaxAnalyzer,
            final DependencyResolver dependencyResolver,
            final CliFrameworkDetector cliFrameworkDetector) {
        return new SafeIntrospectionStrategy(metadataParser, syntaxAnalyzer,
                dependencyResolver, cliFrameworkDetector);
    }

    /**
     * Provides the enhancement step of the import tier.
     *
     * @return an enhancer that adds nothing
     */
    @Bean
    public ImportEnhancer importEnhancer() {
        return new PassThroughImportEnhancer();
    }

    /**
     * Creates the strategy that may execute the script.
     *
     * @param safeStrategy the safe strategy it builds upon
     * @param importEnhancer the enhancement step
     * @return the import strategy
     */
    @Bean
    public ImportIntrospectionStrategy importIntrospectionStrategy(
            final SafeIntrospectionStrategy safeStrategy,
            final ImportEnhancer importEnhancer) {
        return new ImportIntrospectionStrategy(safeStrategy, importEnhancer);
    }

    /**
     * Creates the introspector.
     *
     * @param safeStrategy the safe strategy
     * @param importStrategy the import strategy
     * @param contentHasher the content hasher
     * @return the introspector
     */
    @Bean
    public ScriptIntrospector scriptIntrospector(
            final SafeIntrospectionStrategy safeStrategy,
            final ImportIntrospectionStrategy importStrategy,
            final ContentHasher contentHasher) {
        return new ScriptIntrospector(safeStrategy, importStrategy,
                contentHasher);
    }

    /**
     * Creates the envelope writer.
     *
     * <p>Uses its own mapper; the envelope layout is driven by the model
     * annotations, not by Spring's Jackson customizations.</p>
     *
     * @param pretty whether to indent the output
     * @return the result writer
     */
    @Bean
    public ResultWriter resultWriter(
            @Value("${introspector.output.pretty:true}") final boolean pretty) {
        return new ResultWriter(new ObjectMapper(), pretty);
    }

}
