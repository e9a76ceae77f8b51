package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The argument-parsing framework a script uses.
 *
 * <p>Only the name is detected; version, commands and main callable are
 * kept in the envelope for consumers and stay empty.</p>
 *
 * @param name the framework name: typer, click or argparse
 * @param version the framework version, null
 * @param detectedCommands the sub-commands, empty
 * @param mainCallable the main callable, null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"name", "version", "detected_commands", "main_callable"})
public record CliFrameworkInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("detected_commands") List<String> detectedCommands,
        @JsonProperty("main_callable") String mainCallable
) {

    /** Creates the framework info, copying its commands. */
    public CliFrameworkInfo {
        detectedCommands = List.copyOf(detectedCommands);
    }

    /**
     * Creates a framework info with only the name known.
     *
     * @param name the framework name
     * @return the framework info
     */
    public static CliFrameworkInfo named(final String name) {
        return new CliFrameworkInfo(name, null, List.of(), null);
    }

}
