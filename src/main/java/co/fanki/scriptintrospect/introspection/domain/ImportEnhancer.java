package co.fanki.scriptintrospect.introspection.domain;

/**
 * The import-tier enhancement step: may import or run the script to
 * refine the statically gathered metadata.
 *
 * <p>This is the only place where target code may execute. Any exception
 * it throws is recorded as an {@link ErrorKind#IMPORT_ERROR} and the
 * static metadata is kept.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface ImportEnhancer {

    /**
     * Enhances the metadata of a script.
     *
     * @param source the script
     * @param metadata the metadata gathered statically
     * @return the enhanced metadata
     * @throws Exception if the enhancement fails
     */
    ScriptMetadata enhance(ScriptSource source, ScriptMetadata metadata)
            throws Exception;

}
