package express.mvp.hostcore;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.*;

/** Tests for {@link HostThreadFactory}. */
@SuppressFBWarnings(
        value = {"THROWS_METHOD_THROWS_CLAUSE_BASIC_EXCEPTION"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class HostThreadFactoryTest {

    @Test
    @DisplayName("newThread creates an unstarted platform thread")
    void newThreadUnstarted() throws Exception {
        HostThreadFactory factory = new HostThreadFactory("test");
        CountDownLatch latch = new CountDownLatch(1);

        Thread thread = factory.newThread(latch::countDown);
        assertEquals("test-1", thread.getName());
        assertTrue(thread.isDaemon());
        assertFalse(thread.isAlive());

        thread.start();
        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Thread names increment")
    void threadNamesIncrement() {
        HostThreadFactory factory = new HostThreadFactory("worker");

        assertEquals("worker-1", factory.newThread(() -> {}).getName());
        assertEquals("worker-2", factory.newThread(() -> {}).getName());
    }
}
