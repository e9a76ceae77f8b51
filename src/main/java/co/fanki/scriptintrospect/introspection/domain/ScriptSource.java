package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.DomainException;
import co.fanki.scriptintrospect.shared.Preconditions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The raw bytes of one script, read once.
 *
 * <p>The bytes are kept untouched: they are hashed as is, and decoding
 * is left to the syntax analysis, which honours a coding declaration
 * and reports undecodable input as a syntax error.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ScriptSource {

    private final Path path;
    private final byte[] content;

    private ScriptSource(final Path thePath, final byte[] theContent) {
        this.path = thePath;
        this.content = theContent;
    }

    /**
     * Reads a script from disk.
     *
     * @param scriptPath the script path, relative or absolute
     * @return the script source
     * @throws DomainException with {@link DomainException#SCRIPT_NOT_FOUND}
     *         if the path does not exist, or
     *         {@link DomainException#SCRIPT_UNREADABLE} if it cannot be read
     */
    public static ScriptSource read(final Path scriptPath) {
        Preconditions.requireNonNull(scriptPath, "Script path is required");
        final Path absolute = scriptPath.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new DomainException("Script not found: " + scriptPath,
                    DomainException.SCRIPT_NOT_FOUND);
        }
        if (!Files.isRegularFile(absolute)) {
            throw new DomainException("Script is not a regular file: "
                    + scriptPath, DomainException.SCRIPT_UNREADABLE);
        }
        try {
            return of(absolute, Files.readAllBytes(absolute));
        } catch (final IOException e) {
            throw new DomainException("Cannot read script: " + scriptPath,
                    DomainException.SCRIPT_UNREADABLE, e);
        }
    }

    /**
     * Creates a script source from bytes already in memory.
     *
     * @param scriptPath the path the bytes belong to
     * @param content the raw script bytes, in any encoding
     * @return the script source
     */
    public static ScriptSource of(final Path scriptPath, final byte[] content) {
        Preconditions.requireNonNull(scriptPath, "Script path is required");
        Preconditions.requireNonNull(content, "Script content is required");
        return new ScriptSource(scriptPath.toAbsolutePath().normalize(),
                content.clone());
    }

    /**
     * Returns the script name: the file name without its last extension.
     *
     * @return the name, e.g. {@code hello} for {@code hello.py}
     */
    public String name() {
        final String fileName = fileName();
        final int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Returns the file name, e.g. {@code hello.py}.
     *
     * @return the file name
     */
    public String fileName() {
        final Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    /**
     * Returns the absolute, normalized path.
     *
     * @return the path
     */
    public Path path() {
        return path;
    }

    /**
     * Returns a copy of the raw bytes.
     *
     * @return the bytes as read
     */
    public byte[] content() {
        return content.clone();
    }

}
