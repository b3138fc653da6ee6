package express.mvp.hostcore;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory for host background threads.
 *
 * <p>Created threads are daemon platform threads named "{prefix}-{counter}". Owners that need an
 * identity-derived name rename the thread before starting it.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Multiple threads can call {@link #newThread(Runnable)}
 * concurrently.
 */
public final class HostThreadFactory implements ThreadFactory {

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    private final String namePrefix;

    /**
     * Creates a factory for daemon threads.
     *
     * @param namePrefix the prefix for thread names
     */
    public HostThreadFactory(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    /**
     * Creates a new, unstarted daemon thread.
     *
     * @param runnable the task to execute
     * @return a new platform thread
     */
    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
