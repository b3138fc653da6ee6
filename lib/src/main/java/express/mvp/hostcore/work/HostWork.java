package express.mvp.hostcore.work;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reusable work item for a host work queue.
 *
 * <p>An item is pending from the moment it is queued until its task starts running. Queueing an
 * item that is still pending is a no-op, so the task runs once per batch of requests. The pending
 * flag is cleared before the task runs, which lets the task re-queue its own item.
 */
public final class HostWork {

    private final Runnable task;

    private final AtomicBoolean pending = new AtomicBoolean();

    /**
     * Creates a work item.
     *
     * @param task the task to run each time the item executes
     */
    public HostWork(Runnable task) {
        this.task = Objects.requireNonNull(task, "task must not be null");
    }

    /**
     * Checks if the item is queued and has not started yet.
     *
     * @return true while pending
     */
    public boolean isPending() {
        return pending.get();
    }

    boolean markPending() {
        return pending.compareAndSet(false, true);
    }

    void cancelPending() {
        pending.set(false);
    }

    void run() {
        pending.set(false);
        task.run();
    }
}
