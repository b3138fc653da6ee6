package express.mvp.hostcore.work;

import express.mvp.hostcore.Host;
import express.mvp.hostcore.error.WorkQueueNotConfiguredException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Submits work to a host's private serial work queue.
 *
 * <p>Only hosts whose transport asked for a work queue at publish have one. Using these methods on
 * any other host is a driver bug: it is logged with the caller's stack and rejected. Ordering is
 * the queue's own: FIFO, one item at a time.
 */
public final class WorkQueueBinding {

    private static final Logger LOGGER = Logger.getLogger(WorkQueueBinding.class.getName());

    private WorkQueueBinding() {
        // Utility class
    }

    /**
     * Queues work on the host's work queue.
     *
     * @param host the host
     * @param work the item
     * @return true if queued, false if the item was already pending
     * @throws WorkQueueNotConfiguredException if the host has no work queue
     */
    public static boolean queueWork(Host host, HostWork work) {
        return requireQueue(host, "queue").queue(work);
    }

    /**
     * Waits until all work queued on the host's work queue before this call has finished.
     *
     * @param host the host
     * @throws WorkQueueNotConfiguredException if the host has no work queue
     */
    public static void flushWork(Host host) {
        requireQueue(host, "flush").flush();
    }

    private static HostWorkQueue requireQueue(Host host, String action) {
        HostWorkQueue queue = host.workQueue();
        if (queue == null) {
            WorkQueueNotConfiguredException e =
                    new WorkQueueNotConfiguredException(
                            host.name()
                                    + ": host '"
                                    + host.template().name()
                                    + "' attempted to "
                                    + action
                                    + " work, when no work queue created");
            LOGGER.log(Level.SEVERE, e.getMessage(), e);
            throw e;
        }
        return queue;
    }
}
