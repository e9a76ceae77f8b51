package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The versioned envelope around a script's metadata.
 *
 * @param schemaVersion the envelope schema version
 * @param interpreterVersion the runtime that produced the result
 * @param contentHash the SHA-256 hex digest of the raw script bytes
 * @param metadata the script metadata
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"schema_version", "interpreter_version", "content_hash",
        "metadata"})
public record IntrospectionResult(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("interpreter_version") String interpreterVersion,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("metadata") ScriptMetadata metadata
) {
}
