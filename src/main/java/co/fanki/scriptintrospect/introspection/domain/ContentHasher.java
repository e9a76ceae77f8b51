package co.fanki.scriptintrospect.introspection.domain;

import co.fanki.scriptintrospect.shared.Preconditions;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes the content hash of a script: SHA-256 over its raw bytes,
 * as lowercase hex.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";

    /**
     * Hashes the given bytes.
     *
     * @param content the raw bytes
     * @return the 64 character hex digest
     */
    public String hash(final byte[] content) {
        Preconditions.requireNonNull(content, "Content is required");
        try {
            final MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

}
