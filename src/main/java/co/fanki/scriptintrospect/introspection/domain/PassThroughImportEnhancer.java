package co.fanki.scriptintrospect.introspection.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default enhancement step: returns the static metadata unchanged.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PassThroughImportEnhancer implements ImportEnhancer {

    private static final Logger LOG = LoggerFactory.getLogger(
            PassThroughImportEnhancer.class);

    @Override
    public ScriptMetadata enhance(final ScriptSource source,
            final ScriptMetadata metadata) {
        LOG.debug("No import-based analysis for {}", source.path());
        return metadata;
    }

}
