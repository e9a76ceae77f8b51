package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a dependency candidate came from.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DependencyProvenance {

    /** Listed in the inline metadata block; authoritative. */
    DECLARED("Declared"),

    /** Guessed from an import statement; heuristic. */
    INFERRED("Inferred");

    private final String label;

    DependencyProvenance(final String theLabel) {
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
