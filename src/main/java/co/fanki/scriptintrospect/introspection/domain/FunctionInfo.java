package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A function or method defined in a script.
 *
 * @param name the function name
 * @param line the 1-based line of the definition
 * @param docstring the cleaned docstring, or null
 * @param parameters the positional parameters in order
 * @param returns the return annotation text, or null
 * @param decorators the decorator texts in order
 * @param async whether it is an {@code async def}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "line", "docstring", "parameters", "returns",
        "decorators", "is_async"})
public record FunctionInfo(
        @JsonProperty("name") String name,
        @JsonProperty("line") int line,
        @JsonProperty("docstring") String docstring,
        @JsonProperty("parameters") List<ParameterInfo> parameters,
        @JsonProperty("returns") String returns,
        @JsonProperty("decorators") List<String> decorators,
        @JsonProperty("is_async") boolean async
) {

    /** Creates the function, copying its lists. */
    public FunctionInfo {
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
    }

}
