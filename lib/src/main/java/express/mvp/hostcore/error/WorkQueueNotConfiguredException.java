package express.mvp.hostcore.error;

/**
 * Thrown when work is queued or flushed on a host whose transport never asked for a work queue.
 *
 * <p>This always indicates a programming error in the caller.
 */
public class WorkQueueNotConfiguredException extends HostException {

    public WorkQueueNotConfiguredException(String message) {
        super(HostErrorCode.NOT_CONFIGURED, message);
    }
}
