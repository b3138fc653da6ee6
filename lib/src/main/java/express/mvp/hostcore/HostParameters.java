package express.mvp.hostcore;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Process-wide tunables for host lifecycle management.
 *
 * <p>The error-handler deadline is read from the system property {@code hostcore.eh_deadline}
 * (seconds, {@code -1} disables it) and may be changed at runtime. Each host converts the value
 * once, at allocation.
 */
public final class HostParameters {

    private static final Logger LOGGER = Logger.getLogger(HostParameters.class.getName());

    /** System property holding the initial deadline in seconds. */
    public static final String EH_DEADLINE_PROPERTY = "hostcore.eh_deadline";

    /** Deadline value meaning "no deadline". */
    public static final int DEADLINE_DISABLED = -1;

    /** Resolution of the converted deadline. */
    public static final int TICKS_PER_SECOND = 1000;

    private static volatile int errorHandlerDeadlineSeconds =
            Integer.getInteger(EH_DEADLINE_PROPERTY, DEADLINE_DISABLED);

    private HostParameters() {
        // Utility class
    }

    /**
     * Returns the configured error-handler deadline.
     *
     * @return seconds, or {@link #DEADLINE_DISABLED}
     */
    public static int errorHandlerDeadlineSeconds() {
        return errorHandlerDeadlineSeconds;
    }

    /**
     * Sets the error-handler deadline used by hosts allocated from now on.
     *
     * @param seconds deadline in seconds, or {@link #DEADLINE_DISABLED}
     */
    public static void setErrorHandlerDeadlineSeconds(int seconds) {
        errorHandlerDeadlineSeconds = seconds;
    }

    /**
     * Converts a deadline for one host.
     *
     * <p>Values whose tick count does not fit an {@code int} are clamped to
     * {@link Integer#MAX_VALUE} ticks with a warning. Negative values other than
     * {@link #DEADLINE_DISABLED} are read as unsigned and therefore clamped too.
     *
     * @param seconds configured deadline
     * @param hasHostResetHandler whether the host's template can reset the host
     * @param hostName host name for the warning
     * @return the deadline, or null when disabled
     */
    static Duration resolveErrorHandlerDeadline(
            int seconds, boolean hasHostResetHandler, String hostName) {
        if (seconds == DEADLINE_DISABLED || !hasHostResetHandler) {
            return null;
        }
        long ticks = Integer.toUnsignedLong(seconds) * TICKS_PER_SECOND;
        if (ticks > Integer.MAX_VALUE) {
            LOGGER.warning(
                    hostName
                            + ": eh_deadline "
                            + Integer.toUnsignedString(seconds)
                            + " too large, setting to "
                            + Integer.MAX_VALUE / TICKS_PER_SECOND);
            ticks = Integer.MAX_VALUE;
        }
        return Duration.ofMillis(ticks * 1000 / TICKS_PER_SECOND);
    }
}
