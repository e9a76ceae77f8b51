package co.fanki.scriptintrospect.documentation;

import co.fanki.scriptintrospect.introspection.domain.FunctionInfo;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A function as shown to the documentation generator.
 *
 * @param name the function name
 * @param docstring the cleaned docstring, may be null
 * @param line the 1-based definition line
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "docstring", "line_number"})
public record FunctionSummary(
        @JsonProperty("name") String name,
        @JsonProperty("docstring") String docstring,
        @JsonProperty("line_number") int line
) {

    /**
     * Summarizes an introspected function.
     *
     * @param function the function
     * @return the summary
     */
    public static FunctionSummary of(final FunctionInfo function) {
        return new FunctionSummary(function.name(), function.docstring(),
                function.line());
    }

}
