package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a function was recognized as an entry point.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EntryPointKind {

    /** A function named {@code main}. */
    MAIN_FUNCTION("MainFunction"),

    /** A function carrying a CLI command decorator. */
    CLI_COMMAND("CliCommand");

    private final String label;

    EntryPointKind(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the tag written to the result envelope.
     *
     * @return the label
     */
    @JsonValue
    public String label() {
        return label;
    }

}
