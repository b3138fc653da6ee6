package express.mvp.hostcore.error;

/** Thrown when memory, a thread or a queue cannot be obtained for a host. */
public class ResourceExhaustedException extends HostException {

    public ResourceExhaustedException(String message) {
        super(HostErrorCode.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(HostErrorCode.RESOURCE_EXHAUSTED, message, cause);
    }
}
