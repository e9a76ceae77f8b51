package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;

/**
 * Outcome of {@link SyntaxAnalyzer#analyze}: either the extracted
 * structure or the one error that prevented it.
 *
 * @param structure the structure, null on failure
 * @param error the error, null on success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyntaxAnalysis(ScriptStructure structure, ErrorRecord error) {

    /**
     * Creates a successful analysis.
     *
     * @param structure the extracted structure
     * @return the analysis
     */
    public static SyntaxAnalysis of(final ScriptStructure structure) {
        Preconditions.requireNonNull(structure, "Structure is required");
        return new SyntaxAnalysis(structure, null);
    }

    /**
     * Creates a failed analysis.
     *
     * @param error the error that stopped the analysis
     * @return the analysis
     */
    public static SyntaxAnalysis failed(final ErrorRecord error) {
        Preconditions.requireNonNull(error, "Error is required");
        return new SyntaxAnalysis(null, error);
    }

    /**
     * Checks whether the analysis failed.
     *
     * @return true if there is no structure
     */
    public boolean isFailed() {
        return structure == null;
    }

}
