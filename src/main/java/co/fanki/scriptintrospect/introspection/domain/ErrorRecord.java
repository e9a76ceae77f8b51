package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A recoverable failure encountered while introspecting a script.
 *
 * @param kind the failure kind
 * @param message the failure message
 * @param line the 1-based source line, null when not tied to a line
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"kind", "message", "line"})
public record ErrorRecord(
        @JsonProperty("kind") ErrorKind kind,
        @JsonProperty("message") String message,
        @JsonProperty("line") Integer line
) {

    /**
     * Creates an error record.
     *
     * @param kind the failure kind, required
     * @param message the failure message, required
     * @param line the source line, may be null
     */
    public ErrorRecord {
        Preconditions.requireNonNull(kind, "Error kind is required");
        Preconditions.requireNonNull(message, "Error message is required");
    }

}
