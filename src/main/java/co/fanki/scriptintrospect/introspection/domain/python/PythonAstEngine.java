package co.fanki.scriptintrospect.introspection.domain.python;

import co.fanki.scriptintrospect.shared.Preconditions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the script analyzer on the Python {@code ast} module inside a
 * GraalPy polyglot context.
 *
 * <p>Loads script_analyzer.py from the classpath and evaluates it in a
 * sandboxed context: no I/O, no host access, no native code, no
 * threads. Scripts are parsed, never executed.</p>
 *
 * <p>The context is created once and reused for every script, then
 * closed via {@link #close()}. A polyglot context is single threaded,
 * so calls to {@link #analyze} are serialized.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonAstEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(
            PythonAstEngine.class);

    private static final String ANALYZER_RESOURCE =
            "python/script_analyzer.py";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Context context;
    private final Value analyzeFunction;

    /**
     * Creates a new engine, loading the analyzer script from the
     * classpath into a sandboxed GraalPy context.
     *
     * @throws IOException if the analyzer resource cannot be loaded
     */
    public PythonAstEngine() throws IOException {
        final String analyzerSource = loadAnalyzerFromClasspath();
        LOG.info("Python analyzer loaded ({} bytes)",
                analyzerSource.length());

        this.context = createContext();

        try {
            context.eval(Source.newBuilder("python", analyzerSource,
                    "script_analyzer.py").build());

            this.analyzeFunction = context.getBindings("python")
                    .getMember("analyze_script");

            if (analyzeFunction == null || !analyzeFunction.canExecute()) {
                throw new IllegalStateException(
                        "analyze_script function not found in analyzer");
            }
        } catch (final Exception e) {
            context.close();
            throw e;
        }
    }

    /**
     * Parses a script and extracts its structure.
     *
     * <p>The raw bytes go to the analyzer untouched: it decodes them the
     * way the interpreter would, honouring a coding declaration in the
     * first two lines and defaulting to UTF-8.</p>
     *
     * @param content the raw script bytes
     * @param fileName the file name used in syntax error messages
     * @param commandDecorators dotted decorator names marking a command
     * @return the analysis, carrying either the structure or one error
     * @throws IOException if the analyzer output cannot be read
     */
    public synchronized ModuleAnalysis analyze(final byte[] content,
            final String fileName,
            final Collection<String> commandDecorators) throws IOException {

        Preconditions.requireNonNull(content, "Script content is required");
        Preconditions.requireNonNull(fileName, "File name is required");
        Preconditions.requireNonNull(commandDecorators,
                "Command decorators are required");

        final Map<String, Object> input = new LinkedHashMap<>();
        input.put("content", Base64.getEncoder().encodeToString(content));
        input.put("filename", fileName);
        input.put("command_decorators", new ArrayList<>(commandDecorators));

        final String inputJson = MAPPER.writeValueAsString(input);
        final Value result = analyzeFunction.execute(inputJson);

        return MAPPER.readValue(result.asString(), ModuleAnalysis.class);
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        context.close();
    }

    /**
     * Creates a GraalPy context with the default sandbox: no I/O, no
     * host class lookup, no native access. The language home stays
     * readable so the standard library can be imported.
     */
    private static Context createContext() {
        return Context.newBuilder("python")
                .allowExperimentalOptions(true)
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }

    /** Loads the analyzer script from the classpath. */
    private static String loadAnalyzerFromClasspath() throws IOException {
        try (InputStream is = PythonAstEngine.class.getClassLoader()
                .getResourceAsStream(ANALYZER_RESOURCE)) {
            if (is == null) {
                throw new IOException(
                        "Python analyzer not found on classpath: "
                                + ANALYZER_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

}
