package express.mvp.hostcore.error;

/** Thrown when a host is configured in a way the lifecycle core cannot support. */
public class InvalidConfigurationException extends HostException {

    public InvalidConfigurationException(String message) {
        super(HostErrorCode.INVALID_CONFIGURATION, message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(HostErrorCode.INVALID_CONFIGURATION, message, cause);
    }
}
