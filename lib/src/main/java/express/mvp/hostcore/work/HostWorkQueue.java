package express.mvp.hostcore.work;

import express.mvp.hostcore.error.ResourceExhaustedException;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serial work queue owned by a host.
 *
 * <p>One worker thread drains an unbounded FIFO, so items run one at a time in submission order.
 * Hosts own two of these: the urgent task-management queue created at allocation and, when the
 * transport asks for one, the general work queue created at publish.
 *
 * <h2>Stopping</h2>
 *
 * <ul>
 *   <li>{@link #shutdown()} stops accepting new work; queued items still run
 *   <li>{@link #flush()} waits for everything queued before the call
 *   <li>{@link #destroy()} shuts down and then drains the queue completely
 * </ul>
 *
 * <p>{@link #destroy()} called from the queue's own worker (a work item dropping the last host
 * reference) does not wait for itself; the worker exits once the current item returns.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe.
 */
public class HostWorkQueue {

    private static final Logger LOGGER = Logger.getLogger(HostWorkQueue.class.getName());

    private final String name;

    private final ThreadPoolExecutor executor;

    private volatile Thread worker;

    private final AtomicLong submittedTasks = new AtomicLong(0);

    private final AtomicLong completedTasks = new AtomicLong(0);

    private final AtomicLong failedTasks = new AtomicLong(0);

    private final AtomicLong rejectedTasks = new AtomicLong(0);

    /**
     * Creates a queue with a daemon worker named after the queue.
     *
     * @param name queue name, also the worker thread name
     */
    public HostWorkQueue(String name) {
        this(name, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Creates a queue whose worker comes from the given factory.
     *
     * @param name queue name
     * @param threadFactory factory for the single worker thread
     * @throws ResourceExhaustedException if the worker thread cannot be created
     */
    public HostWorkQueue(String name, ThreadFactory threadFactory) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(threadFactory, "threadFactory");
        this.executor =
                new ThreadPoolExecutor(
                        1,
                        1,
                        0L,
                        TimeUnit.MILLISECONDS,
                        new LinkedBlockingQueue<>(),
                        runnable -> {
                            Thread thread = threadFactory.newThread(runnable);
                            worker = thread;
                            return thread;
                        });
        if (!executor.prestartCoreThread()) {
            executor.shutdown();
            throw new ResourceExhaustedException(name + ": failed to start worker thread");
        }
    }

    public String name() {
        return name;
    }

    /**
     * Queues a work item.
     *
     * @param work the item
     * @return true if queued, false if it was already pending or the queue is shut down
     */
    public boolean queue(HostWork work) {
        Objects.requireNonNull(work, "work must not be null");
        if (!work.markPending()) {
            return false;
        }
        if (!submit(work::run)) {
            work.cancelPending();
            return false;
        }
        return true;
    }

    /**
     * Queues a plain task.
     *
     * @param task the task
     * @return true if accepted, false if the queue is shut down
     */
    public boolean execute(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        return submit(task);
    }

    private boolean submit(Runnable task) {
        try {
            executor.execute(() -> runTask(task));
        } catch (RejectedExecutionException e) {
            rejectedTasks.incrementAndGet();
            LOGGER.log(Level.WARNING, name + ": work submitted after shutdown");
            return false;
        }
        submittedTasks.incrementAndGet();
        return true;
    }

    private void runTask(Runnable task) {
        try {
            task.run();
            completedTasks.incrementAndGet();
        } catch (RuntimeException e) {
            failedTasks.incrementAndGet();
            LOGGER.log(Level.SEVERE, name + ": work item failed", e);
        }
    }

    /**
     * Blocks until every item queued before this call has finished.
     *
     * <p>Interrupts do not cut the wait short; the interrupt status is restored on return.
     *
     * @throws IllegalStateException if called from this queue's own worker
     */
    public void flush() {
        if (isWorkerThread()) {
            throw new IllegalStateException(name + ": flush from own worker would deadlock");
        }
        FutureTask<Void> barrier = new FutureTask<>(() -> { }, null);
        try {
            executor.execute(barrier);
        } catch (RejectedExecutionException e) {
            // Shut down: whatever is left drains before termination
            awaitTerminationUninterruptibly();
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                barrier.get();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            } catch (ExecutionException e) {
                throw new IllegalStateException(name + ": flush barrier failed", e.getCause());
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /** Stops accepting new work. Items already queued still run. */
    public void shutdown() {
        executor.shutdown();
    }

    /**
     * Stops accepting new work and waits until all queued items have run.
     *
     * <p>When called from the worker itself, returns without waiting.
     */
    public void destroy() {
        executor.shutdown();
        if (isWorkerThread()) {
            return;
        }
        awaitTerminationUninterruptibly();
    }

    private void awaitTerminationUninterruptibly() {
        boolean interrupted = false;
        while (true) {
            try {
                if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Checks if the calling thread is this queue's worker.
     *
     * @return true on the worker thread
     */
    public boolean isWorkerThread() {
        return Thread.currentThread() == worker;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    /**
     * Returns the number of items waiting to run.
     *
     * @return queued item count
     */
    public int queuedCount() {
        return executor.getQueue().size();
    }

    /**
     * Returns a snapshot of the queue counters.
     *
     * @return the statistics
     */
    public Stats getStats() {
        return new Stats(
                submittedTasks.get(), completedTasks.get(), failedTasks.get(), rejectedTasks.get());
    }

    @Override
    public String toString() {
        return "HostWorkQueue[" + name + ", queued=" + queuedCount() + "]";
    }

    /**
     * Queue counters.
     *
     * @param submitted items accepted
     * @param completed items that returned normally
     * @param failed items that threw
     * @param rejected items refused after shutdown
     */
    public record Stats(long submitted, long completed, long failed, long rejected) {}
}
