package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tells which argument-parsing framework a script uses from its imports.
 *
 * <p>Priority: typer, then click, then argparse. Only exact module names
 * count, so {@code import click.testing} alone does not mean click.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CliFrameworkDetector {

    /** Known frameworks, highest priority first. */
    private static final List<String> FRAMEWORKS = List.of(
            "typer", "click", "argparse");

    /**
     * Detects the framework.
     *
     * @param imports the imports of the script
     * @return the framework, or null if none is imported
     */
    public CliFrameworkInfo detect(final List<ImportInfo> imports) {
        Preconditions.requireNonNull(imports, "Imports are required");
        final Set<String> modules = new HashSet<>();
        for (final ImportInfo info : imports) {
            modules.add(info.module());
        }
        for (final String framework : FRAMEWORKS) {
            if (modules.contains(framework)) {
                return CliFrameworkInfo.named(framework);
            }
        }
        return null;
    }

}
