package co.fanki.scriptintrospect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Script Introspector Application.
 *
 * <p>This is the main entry point of the command line tool that
 * statically analyzes a single-file Python script and prints a
 * versioned JSON envelope describing its metadata, dependencies,
 * entry points, functions, classes and imports.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ScriptIntrospectorApplication {

    /**
     * Main entry point for the application.
     *
     * <p>The process exits with the code produced by the command.</p>
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(ScriptIntrospectorApplication.class,
                        args)));
    }

}
