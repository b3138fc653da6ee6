package express.mvp.hostcore.work;

/**
 * Creates the serial work queues a host owns.
 *
 * <p>Returning null or throwing {@link express.mvp.hostcore.error.HostException} means the queue
 * could not be created.
 */
@FunctionalInterface
public interface WorkQueueFactory {

    /** Factory creating queues with a daemon worker thread. */
    WorkQueueFactory DEFAULT = HostWorkQueue::new;

    /**
     * Creates and starts a queue.
     *
     * @param name queue name derived from the host identity
     * @return the queue, or null if it could not be created
     */
    HostWorkQueue create(String name);
}
