package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A likely program entry of a script.
 *
 * @param name the entry point name
 * @param callable the name of the function to call
 * @param module the owning module, null for the script itself
 * @param kind how the entry point was recognized
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "callable", "module", "kind"})
public record EntryPointInfo(
        @JsonProperty("name") String name,
        @JsonProperty("callable") String callable,
        @JsonProperty("module") String module,
        @JsonProperty("kind") EntryPointKind kind
) {

    /**
     * Creates an entry point for a function of the script itself.
     *
     * @param function the function name
     * @param kind how it was recognized
     * @return the entry point
     */
    public static EntryPointInfo of(final String function,
            final EntryPointKind kind) {
        return new EntryPointInfo(function, function, null, kind);
    }

}
