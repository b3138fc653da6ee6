package express.mvp.hostcore.recovery;

import java.time.Duration;

/** View of the recovery thread given to the recovery logic it runs. */
public interface RecoveryContext {

    /**
     * Checks if the owning host asked the thread to exit.
     *
     * @return true once a stop was requested
     */
    boolean shouldStop();

    /**
     * Waits until the host wakes the thread, a stop is requested, or the timeout passes.
     *
     * @param timeout longest time to wait
     * @return true if woken for work, false on timeout or stop
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitWakeup(Duration timeout) throws InterruptedException;
}
