package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A class defined in a script.
 *
 * @param name the class name
 * @param line the 1-based line of the definition
 * @param docstring the cleaned docstring, or null
 * @param methods the functions defined directly in the class body
 * @param baseClasses the base class texts in order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "line", "docstring", "methods", "base_classes"})
public record ClassInfo(
        @JsonProperty("name") String name,
        @JsonProperty("line") int line,
        @JsonProperty("docstring") String docstring,
        @JsonProperty("methods") List<FunctionInfo> methods,
        @JsonProperty("base_classes") List<String> baseClasses
) {

    /** Creates the class, copying its lists. */
    public ClassInfo {
        methods = List.copyOf(methods);
        baseClasses = List.copyOf(baseClasses);
    }

}
