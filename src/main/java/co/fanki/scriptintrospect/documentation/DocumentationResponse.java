package co.fanki.scriptintrospect.documentation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * What a documentation generator answers.
 *
 * @param success whether a description was produced
 * @param description the description, null on failure
 * @param error why no description was produced, null on success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"success", "description", "error"})
public record DocumentationResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("description") String description,
        @JsonProperty("error") String error
) {

    public static DocumentationResponse success(final String description) {
        return new DocumentationResponse(true, description, null);
    }

    public static DocumentationResponse failure(final String error) {
        return new DocumentationResponse(false, null, error);
    }

}
