package co.fanki.scriptintrospect.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 *
 * <p>Parses the process arguments, runs {@link IntrospectCommand} and
 * keeps its exit code for {@code SpringApplication.exit}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final IntrospectCommand introspectCommand;
    private int exitCode;

    /**
     * Creates the runner.
     *
     * @param theIntrospectCommand the command bean
     */
    public CliRunner(final IntrospectCommand theIntrospectCommand) {
        this.introspectCommand = theIntrospectCommand;
    }

    @Override
    public void run(final String... args) {
        exitCode = new CommandLine(introspectCommand).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

}
