package co.fanki.scriptintrospect.introspection.domain;

import java.util.Locale;

/**
 * The trust tier an introspection runs in, chosen by the caller.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum IntrospectionMode {

    /** Static analysis only; the script is never executed. */
    SAFE("safe"),

    /** Static analysis plus the import-based enhancement step. */
    IMPORT("import");

    private final String label;

    IntrospectionMode(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the command-line label of this mode.
     *
     * @return the label
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a mode from its label, ignoring case.
     *
     * @param value the label, e.g. {@code safe}
     * @return the mode
     * @throws IllegalArgumentException if the label is unknown
     */
    public static IntrospectionMode fromLabel(final String value) {
        if (value != null) {
            final String label = value.trim().toLowerCase(Locale.ROOT);
            for (final IntrospectionMode mode : values()) {
                if (mode.label.equals(label)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown introspection mode: "
                + value + " (expected safe or import)");
    }

}
