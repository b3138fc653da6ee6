package express.mvp.hostcore.recovery;

import express.mvp.hostcore.Host;
import express.mvp.hostcore.error.ResourceExhaustedException;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dedicated error-recovery thread owned by a host.
 *
 * <p>Started at allocation and stopped at destruction. The thread only runs the supplied
 * {@link RecoveryHandler}; what recovery does is the handler's business.
 *
 * <p>{@link #stop()} requests an exit, interrupts the thread and waits for it, except when called
 * from the recovery thread itself (recovery logic dropping the last host reference), where it only
 * requests the exit.
 */
public final class RecoveryThread implements RecoveryContext {

    private static final Logger LOGGER = Logger.getLogger(RecoveryThread.class.getName());

    private final Host host;

    private final RecoveryHandler handler;

    private final Semaphore wakeups = new Semaphore(0);

    private volatile boolean stopRequested;

    private volatile Thread thread;

    private RecoveryThread(Host host, RecoveryHandler handler) {
        this.host = host;
        this.handler = handler;
    }

    /**
     * Creates and starts a recovery thread.
     *
     * @param host the owning host
     * @param handler recovery logic to run
     * @param threadFactory source of the platform thread
     * @param name thread name, derived from the host identity
     * @return the running thread
     * @throws ResourceExhaustedException if the thread cannot be created or started
     */
    public static RecoveryThread start(
            Host host, RecoveryHandler handler, ThreadFactory threadFactory, String name) {
        RecoveryThread recovery = new RecoveryThread(host, handler);
        Thread thread = threadFactory.newThread(recovery::runLoop);
        if (thread == null) {
            throw new ResourceExhaustedException(
                    host.name() + ": error handler thread failed to spawn");
        }
        thread.setName(name);
        recovery.thread = thread;
        try {
            thread.start();
        } catch (OutOfMemoryError e) {
            // "unable to create native thread"
            throw new ResourceExhaustedException(
                    host.name() + ": error handler thread failed to spawn", e);
        }
        return recovery;
    }

    private void runLoop() {
        try {
            handler.run(host, this);
        } catch (InterruptedException e) {
            if (!stopRequested) {
                LOGGER.log(Level.WARNING, host.name() + ": error handler interrupted", e);
            }
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, host.name() + ": error handler terminated", e);
        }
    }

    /** Wakes the handler if it is waiting in {@link #awaitWakeup(Duration)}. */
    public void wakeup() {
        if (wakeups.availablePermits() == 0) {
            wakeups.release();
        }
    }

    @Override
    public boolean shouldStop() {
        return stopRequested;
    }

    @Override
    public boolean awaitWakeup(Duration timeout) throws InterruptedException {
        if (stopRequested) {
            return false;
        }
        boolean woken = wakeups.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        wakeups.drainPermits();
        return woken && !stopRequested;
    }

    /**
     * Stops the thread and waits for it to exit.
     *
     * <p>Interrupts do not cut the wait short; the interrupt status is restored on return.
     */
    public void stop() {
        stopRequested = true;
        wakeups.release();
        thread.interrupt();
        if (Thread.currentThread() == thread) {
            return;
        }
        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    public String name() {
        return thread.getName();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    /**
     * Checks if the calling thread is this recovery thread.
     *
     * @return true on the recovery thread
     */
    public boolean isCurrentThread() {
        return Thread.currentThread() == thread;
    }
}
