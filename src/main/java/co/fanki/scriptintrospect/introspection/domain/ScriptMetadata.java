package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything learned about one script.
 *
 * <p>List fields are never null. When structural analysis fails the
 * metadata takes the {@link #fallback fallback} shape: only name, path
 * and errors are populated.</p>
 *
 * @param name the script file name without extension
 * @param path the absolute script path
 * @param description the first line of the docstring, or null
 * @param docstring the module docstring, or null
 * @param inlineMetadataBlock the inline metadata block, or null
 * @param dependencies declared then inferred dependency candidates
 * @param entryPoints the likely entry points in source order
 * @param functions every function and method in source order
 * @param classes every class in source order
 * @param imports every import in source order
 * @param cliFramework the detected CLI framework, or null
 * @param errors the recoverable failures, in the order they happened
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "path", "description", "docstring",
        "inline_metadata_block", "dependencies", "entry_points", "functions",
        "classes", "imports", "cli_framework", "errors"})
public record ScriptMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("description") String description,
        @JsonProperty("docstring") String docstring,
        @JsonProperty("inline_metadata_block")
        InlineMetadataBlock inlineMetadataBlock,
        @JsonProperty("dependencies") List<DependencyInfo> dependencies,
        @JsonProperty("entry_points") List<EntryPointInfo> entryPoints,
        @JsonProperty("functions") List<FunctionInfo> functions,
        @JsonProperty("classes") List<ClassInfo> classes,
        @JsonProperty("imports") List<ImportInfo> imports,
        @JsonProperty("cli_framework") CliFrameworkInfo cliFramework,
        @JsonProperty("errors") List<ErrorRecord> errors
) {

    /** Creates the metadata, copying its lists. */
    public ScriptMetadata {
        Preconditions.requireNonNull(name, "Script name is required");
        Preconditions.requireNonNull(path, "Script path is required");
        dependencies = List.copyOf(dependencies);
        entryPoints = List.copyOf(entryPoints);
        functions = List.copyOf(functions);
        classes = List.copyOf(classes);
        imports = List.copyOf(imports);
        errors = List.copyOf(errors);
    }

    /**
     * Creates the metadata of a script whose structure could not be
     * extracted.
     *
     * @param name the script name
     * @param path the script path
     * @param errors the errors explaining why
     * @return metadata with every optional field null and every list empty
     *         but the errors
     */
    public static ScriptMetadata fallback(final String name, final String path,
            final List<ErrorRecord> errors) {
        return new ScriptMetadata(name, path, null, null, null, List.of(),
                List.of(), List.of(), List.of(), List.of(), null, errors);
    }

    /**
     * Returns a copy of this metadata with one more error appended.
     *
     * @param error the error to append
     * @return the new metadata, other fields unchanged
     */
    public ScriptMetadata withError(final ErrorRecord error) {
        Preconditions.requireNonNull(error, "Error is required");
        final List<ErrorRecord> all = new ArrayList<>(errors);
        all.add(error);
        return new ScriptMetadata(name, path, description, docstring,
                inlineMetadataBlock, dependencies, entryPoints, functions,
                classes, imports, cliFramework, all);
    }

}
