package express.mvp.hostcore;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link HostParameters}. */
@DisplayName("HostParameters")
class HostParametersTest {

    @Test
    @DisplayName("Disabled by default")
    void disabledByDefault() {
        assertEquals(
                Integer.getInteger(HostParameters.EH_DEADLINE_PROPERTY, -1),
                HostParameters.errorHandlerDeadlineSeconds());
    }

    @Test
    @DisplayName("-1 means no deadline")
    void minusOneDisables() {
        assertNull(HostParameters.resolveErrorHandlerDeadline(-1, true, "host0"));
    }

    @Test
    @DisplayName("No deadline without a host reset handler")
    void noResetHandler() {
        assertNull(HostParameters.resolveErrorHandlerDeadline(10, false, "host0"));
    }

    @Test
    @DisplayName("Seconds convert to a duration")
    void converts() {
        assertEquals(
                Duration.ofSeconds(10), HostParameters.resolveErrorHandlerDeadline(10, true, "h"));
        assertEquals(Duration.ZERO, HostParameters.resolveErrorHandlerDeadline(0, true, "h"));
    }

    @Test
    @DisplayName("Largest value that fits is not clamped")
    void largestUnclamped() {
        int seconds = Integer.MAX_VALUE / HostParameters.TICKS_PER_SECOND;
        assertEquals(
                Duration.ofSeconds(seconds),
                HostParameters.resolveErrorHandlerDeadline(seconds, true, "h"));
    }

    @Test
    @DisplayName("Overflowing values clamp to the maximum tick count")
    void clampsOnOverflow() {
        Duration max = Duration.ofMillis(Integer.MAX_VALUE);
        assertEquals(max, HostParameters.resolveErrorHandlerDeadline(Integer.MAX_VALUE, true, "h"));
        assertEquals(
                max,
                HostParameters.resolveErrorHandlerDeadline(
                        Integer.MAX_VALUE / HostParameters.TICKS_PER_SECOND + 1, true, "h"));
    }

    @Test
    @DisplayName("Negative values other than -1 are read unsigned and clamp")
    void negativeClamps() {
        assertEquals(
                Duration.ofMillis(Integer.MAX_VALUE),
                HostParameters.resolveErrorHandlerDeadline(-2, true, "h"));
    }

    @Test
    @DisplayName("Runtime changes are visible")
    void runtimeChange() {
        int saved = HostParameters.errorHandlerDeadlineSeconds();
        try {
            HostParameters.setErrorHandlerDeadlineSeconds(45);
            assertEquals(45, HostParameters.errorHandlerDeadlineSeconds());
        } finally {
            HostParameters.setErrorHandlerDeadlineSeconds(saved);
        }
    }
}
