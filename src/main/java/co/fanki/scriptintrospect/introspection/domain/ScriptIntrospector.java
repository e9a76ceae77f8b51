package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Entry point of the engine: reads a script, runs the strategy of the
 * requested trust tier and wraps the metadata in a versioned envelope.
 *
 * <p>The content hash is computed over the raw bytes independently of
 * the analysis outcome. Each call is self-contained; the same script
 * and mode always yield an equal result.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScriptIntrospector {

    private static final Logger LOG = LoggerFactory.getLogger(
            ScriptIntrospector.class);

    /** The version of the result envelope shape. */
    public static final String SCHEMA_VERSION = "1.0.0";

    private final IntrospectionStrategy safeStrategy;
    private final IntrospectionStrategy importStrategy;
    private final ContentHasher contentHasher;

    /**
     * Creates a new introspector.
     *
     * @param theSafeStrategy the strategy for {@link IntrospectionMode#SAFE}
     * @param theImportStrategy the strategy for
     *                          {@link IntrospectionMode#IMPORT}
     * @param theContentHasher hashes the raw script bytes
     */
    public ScriptIntrospector(final IntrospectionStrategy theSafeStrategy,
            final IntrospectionStrategy theImportStrategy,
            final ContentHasher theContentHasher) {
        this.safeStrategy = Preconditions.requireNonNull(theSafeStrategy,
                "Safe strategy is required");
        this.importStrategy = Preconditions.requireNonNull(theImportStrategy,
                "Import strategy is required");
        this.contentHasher = Preconditions.requireNonNull(theContentHasher,
                "Content hasher is required");
    }

    /**
     * Reads and introspects a script.
     *
     * @param scriptPath the script path
     * @param mode the trust tier
     * @return the result envelope
     * @throws co.fanki.scriptintrospect.shared.DomainException if the
     *         script does not exist or cannot be read
     */
    public IntrospectionResult introspect(final Path scriptPath,
            final IntrospectionMode mode) {
        return introspect(ScriptSource.read(scriptPath), mode);
    }

    /**
     * Introspects a script already read.
     *
     * @param source the script
     * @param mode the trust tier
     * @return the result envelope
     */
    public IntrospectionResult introspect(final ScriptSource source,
            final IntrospectionMode mode) {
        Preconditions.requireNonNull(source, "Script source is required");
        Preconditions.requireNonNull(mode, "Mode is required");

        final String contentHash = contentHasher.hash(source.content());
        final IntrospectionStrategy strategy = switch (mode) {
            case SAFE -> safeStrategy;
            case IMPORT -> importStrategy;
        };
        final ScriptMetadata metadata = strategy.introspect(source);

        LOG.info("Introspected {} in {} mode: {} functions, {} classes,"
                + " {} imports, {} errors", source.path(), mode.label(),
                metadata.functions().size(), metadata.classes().size(),
                metadata.imports().size(), metadata.errors().size());

        return new IntrospectionResult(SCHEMA_VERSION, interpreterVersion(),
                contentHash, metadata);
    }

    /**
     * Identifies the runtime executing the engine.
     *
     * @return e.g. {@code Java 17.0.9 (Eclipse Adoptium)}
     */
    public static String interpreterVersion() {
        return "Java " + Runtime.version() + " ("
                + System.getProperty("java.vendor") + ")";
    }

}
