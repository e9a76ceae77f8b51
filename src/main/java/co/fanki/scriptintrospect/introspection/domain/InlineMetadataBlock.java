package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The inline script metadata block of a script.
 *
 * @param dependencies the raw dependency specifiers, e.g. {@code click>=8}
 * @param minInterpreter the {@code requires-python} value, or null
 * @param toolConfig the {@code [tool]} table, empty when absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"dependencies", "min_interpreter", "tool_config"})
public record InlineMetadataBlock(
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("min_interpreter") String minInterpreter,
        @JsonProperty("tool_config") Map<String, Object> toolConfig
) {

    /** Creates the block, copying its collections and keeping key order. */
    public InlineMetadataBlock {
        dependencies = List.copyOf(dependencies);
        toolConfig = toolConfig == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(toolConfig));
    }

}
