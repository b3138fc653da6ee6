package express.mvp.hostcore.error;

/**
 * Error taxonomy for host lifecycle operations.
 *
 * <p>Each code maps to a negative errno-style value so failures can be reported to callers that
 * expect numeric status codes.
 *
 * <ul>
 *   <li><b>INVALID_CONFIGURATION:</b> zero queue depth, work queue creation refused
 *   <li><b>RESOURCE_EXHAUSTED:</b> allocation, thread or queue creation failure
 *   <li><b>REGISTRATION_FAILURE:</b> device-model or metadata registration failed
 *   <li><b>ILLEGAL_STATE_TRANSITION:</b> transition not in the host state table
 *   <li><b>ALREADY_DELETED:</b> reference requested on a deleted host
 *   <li><b>NOT_CONFIGURED:</b> work queue used on a host that never created one
 * </ul>
 *
 * @see HostException
 */
public enum HostErrorCode {
    INVALID_CONFIGURATION(-22),
    RESOURCE_EXHAUSTED(-12),
    REGISTRATION_FAILURE(-19),
    ILLEGAL_STATE_TRANSITION(-22),
    ALREADY_DELETED(-19),
    NOT_CONFIGURED(-22);

    private final int errno;

    HostErrorCode(int errno) {
        this.errno = errno;
    }

    /**
     * Returns the negative errno-style value for this code.
     *
     * @return the numeric code, always negative
     */
    public int errno() {
        return errno;
    }
}
