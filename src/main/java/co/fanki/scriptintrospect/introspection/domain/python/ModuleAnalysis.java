package co.fanki.scriptintrospect.introspection.domain.python;

import co.fanki.scriptintrospect.introspection.domain.ClassInfo;
import co.fanki.scriptintrospect.introspection.domain.EntryPointInfo;
import co.fanki.scriptintrospect.introspection.domain.ErrorRecord;
import co.fanki.scriptintrospect.introspection.domain.FunctionInfo;
import co.fanki.scriptintrospect.introspection.domain.ImportInfo;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What the Python analyzer reports for one script.
 *
 * <p>Either {@code error} is set and everything else is empty, or the
 * script parsed and the structure is filled in source order.</p>
 *
 * @param error the syntax or extraction error, null on success
 * @param text the decoded source with {@code \n} line endings
 * @param docstring the raw module docstring, or null
 * @param functions every function and method in source order
 * @param classes every class in source order
 * @param imports every import in source order
 * @param entryPoints the entry points in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ModuleAnalysis(
        @JsonProperty("error") ErrorRecord error,
        @JsonProperty("text") String text,
        @JsonProperty("docstring") String docstring,
        @JsonProperty("functions") List<FunctionInfo> functions,
        @JsonProperty("classes") List<ClassInfo> classes,
        @JsonProperty("imports") List<ImportInfo> imports,
        @JsonProperty("entry_points") List<EntryPointInfo> entryPoints
) {

    /** Creates the analysis; missing lists become empty. */
    public ModuleAnalysis {
        functions = functions == null ? List.of() : List.copyOf(functions);
        classes = classes == null ? List.of() : List.copyOf(classes);
        imports = imports == null ? List.of() : List.copyOf(imports);
        entryPoints = entryPoints == null ? List.of()
                : List.copyOf(entryPoints);
    }

    /**
     * Checks whether the analyzer reported an error.
     *
     * @return true if there is no structure
     */
    public boolean isFailed() {
        return error != null;
    }

}
