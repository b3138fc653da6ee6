package express.mvp.hostcore.error;

import java.util.Objects;

/**
 * Unchecked exception thrown when a host lifecycle operation fails.
 *
 * <p>Every failure carries a {@link HostErrorCode} and a negative numeric {@link #code()}. The
 * numeric code defaults to the error code's errno value but collaborators may report their own
 * (for example a device-model registration returning {@code -17}).
 *
 * <h2>Error Recovery</h2>
 *
 * <p>Multi-step operations (allocate, publish) have already released every resource they acquired
 * by the time this exception reaches the caller. Cleanup failures during that unwinding are
 * attached as suppressed exceptions.
 */
public class HostException extends RuntimeException {

    private final HostErrorCode errorCode;

    private final int code;

    /**
     * Constructs a new host exception.
     *
     * @param errorCode the error category
     * @param message the detail message
     */
    public HostException(HostErrorCode errorCode, String message) {
        this(errorCode, errorCode.errno(), message, null);
    }

    /**
     * Constructs a new host exception with a cause.
     *
     * @param errorCode the error category
     * @param message the detail message
     * @param cause the underlying cause
     */
    public HostException(HostErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, errorCode.errno(), message, cause);
    }

    /**
     * Constructs a new host exception with an explicit numeric code.
     *
     * @param errorCode the error category
     * @param code the negative numeric code reported to callers
     * @param message the detail message
     * @param cause the underlying cause (may be null)
     */
    public HostException(HostErrorCode errorCode, int code, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.code = code < 0 ? code : errorCode.errno();
    }

    /**
     * Returns the error category.
     *
     * @return the error code
     */
    public HostErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Returns the negative numeric status for this failure.
     *
     * @return the numeric code
     */
    public int code() {
        return code;
    }
}
