package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.introspection.domain.python.ModuleAnalysis;
import co.fanki.scriptintrospect.introspection.domain.python.PythonAstEngine;
import co.fanki.scriptintrospect.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Parses a script and extracts its structure without executing it.
 *
 * <p>Parsing and extraction run on the Python {@code ast} module through
 * {@link PythonAstEngine}. A syntax error, including source bytes that
 * cannot be decoded, stops the analysis with a single
 * {@link ErrorKind#SYNTAX_ERROR} record. Once the script parses, the
 * tree is walked once in source order, descending into every block, so
 * functions, classes and imports nested at any depth are reported in
 * the order they are written. Any failure during extraction discards
 * the whole structure and yields a single {@link ErrorKind#RUNTIME_ERROR}
 * record.</p>
 *
 * <p>Entry points: a function named {@code main} is a
 * {@link EntryPointKind#MAIN_FUNCTION}; otherwise a function with a
 * decorator whose dotted name (call arguments ignored) is one of the
 * configured command decorators is a {@link EntryPointKind#CLI_COMMAND}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SyntaxAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            SyntaxAnalyzer.class);

    private final List<String> commandDecorators;
    private final PythonAstEngine engine;

    /**
     * Creates a new analyzer.
     *
     * @param theCommandDecorators dotted decorator names marking CLI
     *                             commands, e.g. {@code click.command}
     * @param theEngine parses scripts and extracts their structure
     */
    public SyntaxAnalyzer(final Collection<String> theCommandDecorators,
            final PythonAstEngine theEngine) {
        Preconditions.requireNonNull(theCommandDecorators,
                "Command decorators are required");
        this.commandDecorators = List.copyOf(theCommandDecorators);
        this.engine = Preconditions.requireNonNull(theEngine,
                "Python engine is required");
    }

    /**
     * Analyzes a script.
     *
     * @param source the script
     * @return the structure, or the error that prevented it
     */
    public SyntaxAnalysis analyze(final ScriptSource source) {
        Preconditions.requireNonNull(source, "Script source is required");
        final ModuleAnalysis module;
        try {
            module = engine.analyze(source.content(), source.fileName(),
                    commandDecorators);
        } catch (final IOException | RuntimeException e) {
            LOG.warn("Structure extraction failed for {}", source.path(), e);
            return runtimeError(describe(e));
        } catch (final StackOverflowError e) {
            LOG.warn("Structure extraction of {} exhausted the stack",
                    source.path());
            return runtimeError("maximum nesting depth exceeded");
        }

        if (module.isFailed()) {
            LOG.warn("Analysis of {} failed: {}", source.path(),
                    module.error().message());
            return SyntaxAnalysis.failed(module.error());
        }

        LOG.debug("Extracted {} functions, {} classes, {} imports",
                module.functions().size(), module.classes().size(),
                module.imports().size());
        return SyntaxAnalysis.of(new ScriptStructure(module.text(),
                module.docstring(), descriptionOf(module.docstring()),
                module.functions(), module.classes(), module.imports(),
                module.entryPoints()));
    }

    /**
     * Returns the first line of the docstring, stripped, unless it is
     * empty or looks like a string delimiter.
     */
    static String descriptionOf(final String docstring) {
        if (docstring == null || docstring.isEmpty()) {
            return null;
        }
        final String firstLine = docstring.split("\n", -1)[0].strip();
        if (firstLine.isEmpty() || firstLine.startsWith("\"\"\"")
                || firstLine.startsWith("'''")) {
            return null;
        }
        return firstLine;
    }

    private static SyntaxAnalysis runtimeError(final String detail) {
        return SyntaxAnalysis.failed(new ErrorRecord(ErrorKind.RUNTIME_ERROR,
                "Introspection failed: " + detail, null));
    }

    private static String describe(final Exception e) {
        return e.getMessage() != null ? e.getMessage()
                : e.getClass().getSimpleName();
    }

}
