package co.fanki.scriptintrospect.introspection.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of recoverable failures recorded in a result.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ErrorKind {

    /** The script is not valid Python. */
    SYNTAX_ERROR("SyntaxError"),

    /** An extractor failed after the script parsed. */
    RUNTIME_ERROR("RuntimeError"),

    /** The import-based enhancement step failed. */
    IMPORT_ERROR("ImportError");

    private final String label;

    ErrorKind(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the tag written to the result envelope.
     *
     * @return the label, e.g. {@code SyntaxError}
     */
    @JsonValue
    public String label() {
        return label;
    }

}
