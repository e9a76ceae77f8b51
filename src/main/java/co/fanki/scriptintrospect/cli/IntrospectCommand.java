package co.fanki.scriptintrospect.cli;

import co.fanki.scriptintrospect.introspection.domain.IntrospectionMode;
import co.fanki.scriptintrospect.introspection.domain.IntrospectionResult;
import co.fanki.scriptintrospect.introspection.domain.ResultWriter;
import co.fanki.scriptintrospect.introspection.domain.ScriptIntrospector;
import co.fanki.scriptintrospect.shared.DomainException;
import co.fanki.scriptintrospect.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: script-introspector &lt;script&gt; [--mode] [--output].
 *
 * <p>Prints the result envelope to standard output, or writes it to the
 * output file. A result whose error list is not empty is still a
 * success; only a script that cannot be read ends with exit code 1 and
 * no envelope.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(name = "script-introspector", mixinStandardHelpOptions = true,
        version = "script-introspector 0.1.0",
        description = "Statically introspects a single-file Python script"
                + " and prints its metadata as JSON.")
@Component
public class IntrospectCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(
            IntrospectCommand.class);

    @Parameters(index = "0", paramLabel = "<script>",
            description = "Path of the Python script to introspect")
    private Path scriptPath;

    @Option(names = "--mode", paramLabel = "<mode>", defaultValue = "safe",
            converter = IntrospectionModeConverter.class,
            description = "Trust tier: safe (never executes the script) or"
                    + " import. Default: ${DEFAULT-VALUE}")
    private IntrospectionMode mode;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>",
            description = "Write the result to this file instead of"
                    + " standard output")
    private Path output;

    @Spec
    private CommandSpec spec;

    private final ScriptIntrospector introspector;
    private final ResultWriter resultWriter;

    /**
     * Creates the command.
     *
     * @param theIntrospector the introspection engine
     * @param theResultWriter serializes the envelope
     */
    public IntrospectCommand(final ScriptIntrospector theIntrospector,
            final ResultWriter theResultWriter) {
        this.introspector = Preconditions.requireNonNull(theIntrospector,
                "Introspector is required");
        this.resultWriter = Preconditions.requireNonNull(theResultWriter,
                "Result writer is required");
    }

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        final IntrospectionResult result;
        try {
            result = introspector.introspect(scriptPath, mode);
        } catch (final DomainException e) {
            LOG.debug("Cannot introspect {}: {}", scriptPath, e.getErrorCode());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }

        if (output == null) {
            final PrintWriter out = spec.commandLine().getOut();
            out.println(resultWriter.toJson(result));
            out.flush();
            return 0;
        }
        try {
            resultWriter.write(result, output);
            LOG.info("Result written to {}", output);
            return 0;
        } catch (final IOException e) {
            LOG.warn("Cannot write result to {}", output, e);
            err.println("Error: Cannot write " + output + ": " + e.getMessage());
            err.flush();
            return 1;
        }
    }

}
