package co.fanki.scriptintrospect.documentation;

/**
 * Produces a one-line description of a script, typically backed by a
 * language model.
 *
 * <p>Implementations live outside this project; the engine only builds
 * the request and post-processes the response.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface DocumentationGenerator {

    /**
     * Describes a script.
     *
     * @param request the script and its introspected structure
     * @return the response, never null
     */
    DocumentationResponse generate(DocumentationRequest request);

}
