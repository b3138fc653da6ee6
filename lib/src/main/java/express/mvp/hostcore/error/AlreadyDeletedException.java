package express.mvp.hostcore.error;

/** Thrown when a reference is requested on a host that has reached the deleted state. */
public class AlreadyDeletedException extends HostException {

    public AlreadyDeletedException(String message) {
        super(HostErrorCode.ALREADY_DELETED, message);
    }

    public AlreadyDeletedException(String message, Throwable cause) {
        super(HostErrorCode.ALREADY_DELETED, message, cause);
    }
}
