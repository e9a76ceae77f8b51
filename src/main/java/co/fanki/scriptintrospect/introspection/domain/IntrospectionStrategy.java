package co.fanki.scriptintrospect.introspection.domain;

/**
 * Produces the metadata of a script within one trust tier.
 *
 * <p>Implementations never throw for problems with the script itself;
 * those end up as {@link ErrorRecord}s in the returned metadata.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface IntrospectionStrategy {

    /**
     * Introspects a script.
     *
     * @param source the script
     * @return the metadata, possibly in its fallback shape
     */
    ScriptMetadata introspect(ScriptSource source);

}
