package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Import-tier introspection: the safe strategy followed by the
 * {@link ImportEnhancer} step.
 *
 * <p>The enhancement step only adds: when it fails, the safe metadata is
 * returned with one more {@link ErrorKind#IMPORT_ERROR} record.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportIntrospectionStrategy implements IntrospectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImportIntrospectionStrategy.class);

    private final SafeIntrospectionStrategy safeStrategy;
    private final ImportEnhancer enhancer;

    /**
     * Creates a new import strategy.
     *
     * @param theSafeStrategy the static introspection to run first
     * @param theEnhancer the step allowed to execute the script
     */
    public ImportIntrospectionStrategy(
            final SafeIntrospectionStrategy theSafeStrategy,
            final ImportEnhancer theEnhancer) {
        this.safeStrategy = Preconditions.requireNonNull(theSafeStrategy,
                "Safe strategy is required");
        this.enhancer = Preconditions.requireNonNull(theEnhancer,
                "Import enhancer is required");
    }

    @Override
    public ScriptMetadata introspect(final ScriptSource source) {
        final ScriptMetadata metadata = safeStrategy.introspect(source);
        try {
            final ScriptMetadata enhanced = enhancer.enhance(source, metadata);
            return enhanced != null ? enhanced : metadata;
        } catch (final Exception e) {
            LOG.warn("Import-based analysis of {} failed", source.path(), e);
            final String message = e.getMessage() != null ? e.getMessage()
                    : e.getClass().getSimpleName();
            return metadata.withError(new ErrorRecord(ErrorKind.IMPORT_ERROR,
                    "Import-based analysis failed: " + message, null));
        }
    }

}
