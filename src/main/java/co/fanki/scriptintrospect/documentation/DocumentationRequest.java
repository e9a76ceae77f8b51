package co.fanki.scriptintrospect.documentation;

import co.fanki.scriptintrospect.introspection.domain.DependencyInfo;
import co.fanki.scriptintrospect.introspection.domain.EntryPointInfo;
import co.fanki.scriptintrospect.introspection.domain.IntrospectionResult;
import co.fanki.scriptintrospect.introspection.domain.ScriptMetadata;
import co.fanki.scriptintrospect.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What a documentation generator receives to describe one script.
 *
 * @param scriptContent the script text
 * @param entryPoint the entry point kinds, comma separated, or
 *                   {@code Unknown}
 * @param functions the functions of the script
 * @param dependencies the dependency names
 * @param currentDescription the description already known, empty if none
 * @param maxLength the maximum length of the generated description
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"script_content", "entry_point", "functions",
        "dependencies", "current_description", "max_length"})
public record DocumentationRequest(
        @JsonProperty("script_content") String scriptContent,
        @JsonProperty("entry_point") String entryPoint,
        @JsonProperty("functions") List<FunctionSummary> functions,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("current_description") String currentDescription,
        @JsonProperty("max_length") int maxLength
) {

    /** Terminal friendly description length. */
    public static final int DEFAULT_MAX_LENGTH = 80;

    /** Entry point label when the script has none. */
    static final String UNKNOWN_ENTRY_POINT = "Unknown";

    /** Creates the request, copying its lists. */
    public DocumentationRequest {
        Preconditions.requireNonNull(scriptContent,
                "Script content is required");
        Preconditions.requirePositive(maxLength,
                "Max length must be positive");
        functions = List.copyOf(functions);
        dependencies = List.copyOf(dependencies);
        currentDescription = currentDescription == null ? ""
                : currentDescription;
    }

    /**
     * Builds the request for an introspected script with the default
     * maximum length.
     *
     * @param scriptContent the script text
     * @param result the introspection result of that script
     * @return the request
     */
    public static DocumentationRequest from(final String scriptContent,
            final IntrospectionResult result) {
        return from(scriptContent, result, DEFAULT_MAX_LENGTH);
    }

    /**
     * Builds the request for an introspected script.
     *
     * @param scriptContent the script text
     * @param result the introspection result of that script
     * @param maxLength the maximum description length
     * @return the request
     */
    public static DocumentationRequest from(final String scriptContent,
            final IntrospectionResult result, final int maxLength) {
        Preconditions.requireNonNull(result, "Result is required");
        final ScriptMetadata metadata = result.metadata();

        final Set<String> kinds = new LinkedHashSet<>();
        for (final EntryPointInfo entryPoint : metadata.entryPoints()) {
            kinds.add(entryPoint.kind().label());
        }
        final String entryPoint = kinds.isEmpty() ? UNKNOWN_ENTRY_POINT
                : String.join(", ", kinds);

        return new DocumentationRequest(scriptContent, entryPoint,
                metadata.functions().stream().map(FunctionSummary::of)
                        .toList(),
                metadata.dependencies().stream().map(DependencyInfo::name)
                        .toList(),
                metadata.description(), maxLength);
    }

}
