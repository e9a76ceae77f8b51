package co.fanki.scriptintrospect.shared;

/**
 * Base exception for failures that prevent an introspection result from
 * being built at all.
 *
 * <p>Recoverable problems never surface as this exception: they are
 * recorded inside the result. A domain exception means the caller gets
 * no envelope, e.g. because the target script does not exist or cannot
 * be read.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code for a script path that does not exist. */
    public static final String SCRIPT_NOT_FOUND = "SCRIPT_NOT_FOUND";

    /** Error code for a script that exists but cannot be read. */
    public static final String SCRIPT_UNREADABLE = "SCRIPT_UNREADABLE";

    private final String errorCode;

    /**
     * Creates a new domain exception with a message.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        super(message);
        this.errorCode = "DOMAIN_ERROR";
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code
     */
    public DomainException(final String message, final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param errorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
