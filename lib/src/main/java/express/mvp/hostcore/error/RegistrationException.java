package express.mvp.hostcore.error;

/**
 * Thrown when registering a host with an external layer fails.
 *
 * <p>Collaborators may supply their own negative status code, which is preserved in
 * {@link #code()}.
 */
public class RegistrationException extends HostException {

    public RegistrationException(String message) {
        super(HostErrorCode.REGISTRATION_FAILURE, message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(HostErrorCode.REGISTRATION_FAILURE, message, cause);
    }

    public RegistrationException(int code, String message) {
        super(HostErrorCode.REGISTRATION_FAILURE, code, message, null);
    }
}
