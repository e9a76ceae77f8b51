package co.fanki.scriptintrospect.introspection.domain;

import java.util.List;

/**
 * The structural facts extracted from a parsed script.
 *
 * @param text the decoded source with {@code \n} line endings
 * @param docstring the module docstring, or null
 * @param description the first docstring line, or null
 * @param functions every function and method in source order
 * @param classes every class in source order
 * @param imports every import in source order
 * @param entryPoints the entry points in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScriptStructure(
        String text,
        String docstring,
        String description,
        List<FunctionInfo> functions,
        List<ClassInfo> classes,
        List<ImportInfo> imports,
        List<EntryPointInfo> entryPoints
) {

    /** Creates the structure, copying its lists. */
    public ScriptStructure {
        functions = List.copyOf(functions);
        classes = List.copyOf(classes);
        imports = List.copyOf(imports);
        entryPoints = List.copyOf(entryPoints);
    }

}
