package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A positional parameter of a function.
 *
 * @param name the parameter name
 * @param typeHint the annotation text, or null
 * @param defaultValue the default value text, or null
 * @param hasDefault whether the parameter has a default value
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "type_hint", "default", "has_default"})
public record ParameterInfo(
        @JsonProperty("name") String name,
        @JsonProperty("type_hint") String typeHint,
        @JsonProperty("default") String defaultValue,
        @JsonProperty("has_default") boolean hasDefault
) {
}
