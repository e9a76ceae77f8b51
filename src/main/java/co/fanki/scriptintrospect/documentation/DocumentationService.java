package co.fanki.scriptintrospect.documentation;

import co.fanki.scriptintrospect.introspection.domain.IntrospectionResult;
import co.fanki.scriptintrospect.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes introspected scripts through a {@link DocumentationGenerator}.
 *
 * <p>Builds the request, asks the generator and keeps the description
 * within the requested length. A generator failure is reported in the
 * response, never thrown.</p>
 *
 * <p>This is the integration seam for an external description
 * generator. No generator ships with this application, so the service
 * is not registered as a bean; an embedding application supplies its
 * own {@link DocumentationGenerator} and creates the service.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DocumentationService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DocumentationService.class);

    private final DocumentationGenerator generator;
    private final DescriptionTruncator truncator;

    /**
     * Creates a new documentation service.
     *
     * @param theGenerator the generator to delegate to
     * @param theTruncator fits the description into the maximum length
     */
    public DocumentationService(final DocumentationGenerator theGenerator,
            final DescriptionTruncator theTruncator) {
        this.generator = Preconditions.requireNonNull(theGenerator,
                "Generator is required");
        this.truncator = Preconditions.requireNonNull(theTruncator,
                "Truncator is required");
    }

    /**
     * Describes a script.
     *
     * @param scriptContent the script text
     * @param result the introspection result of that script
     * @param maxLength the maximum description length
     * @return the response
     */
    public DocumentationResponse describe(final String scriptContent,
            final IntrospectionResult result, final int maxLength) {
        final DocumentationRequest request = DocumentationRequest.from(
                scriptContent, result, maxLength);

        final DocumentationResponse response;
        try {
            response = generator.generate(request);
        } catch (final RuntimeException e) {
            LOG.warn("Documentation of {} failed",
                    result.metadata().path(), e);
            return DocumentationResponse.failure(e.getMessage() != null
                    ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (response == null) {
            return DocumentationResponse.failure("No response from generator");
        }
        if (!response.success()) {
            LOG.warn("Documentation of {} failed: {}",
                    result.metadata().path(), response.error());
            return response;
        }
        if (response.description() == null) {
            return DocumentationResponse.failure("No description generated");
        }
        return DocumentationResponse.success(truncator.truncate(
                response.description(), request.maxLength()));
    }

}
