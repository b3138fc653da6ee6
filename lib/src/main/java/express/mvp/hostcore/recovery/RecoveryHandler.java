package express.mvp.hostcore.recovery;

import express.mvp.hostcore.Host;
import java.time.Duration;

/**
 * Recovery logic run by a host's dedicated recovery thread.
 *
 * <p>The handler owns the thread's loop and must return once {@link RecoveryContext#shouldStop()}
 * turns true or the thread is interrupted. It may read the host state but changes it only through
 * {@link Host#completeRecovery()} and the other state operations.
 */
@FunctionalInterface
public interface RecoveryHandler {

    /** Handler that only waits for wakeups until stopped. */
    RecoveryHandler IDLE =
            (host, context) -> {
                while (!context.shouldStop()) {
                    context.awaitWakeup(Duration.ofSeconds(1));
                }
            };

    /**
     * Runs recovery for the host until asked to stop.
     *
     * @param host the host owning the thread
     * @param context stop and wakeup signals
     * @throws Exception on failure; the thread logs it and exits
     */
    void run(Host host, RecoveryContext context) throws Exception;
}
