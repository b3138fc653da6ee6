package express.mvp.hostcore.resource;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ResourceTracker}. */
@DisplayName("ResourceTracker")
class ResourceTrackerTest {

    private ResourceTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ResourceTracker();
    }

    @Nested
    @DisplayName("Tracking")
    class TrackingTests {

        @Test
        @DisplayName("track returns distinct non-zero IDs")
        void trackReturnsDistinctIds() {
            long first = tracker.track("host0", "tag pool", 32);
            long second = tracker.track("host0", "tmf queue", 0);

            assertNotEquals(0, first);
            assertNotEquals(first, second);
            assertEquals(2, tracker.getActiveCount());
            assertEquals(32, tracker.getActiveBytes());
        }

        @Test
        @DisplayName("release removes the record once")
        void releaseRemovesOnce() {
            long id = tracker.track("host0", "private data", 64);

            assertTrue(tracker.release(id));
            assertFalse(tracker.release(id));
            assertEquals(0, tracker.getActiveCount());
            assertEquals(1, tracker.getReleaseCount());
        }

        @Test
        @DisplayName("release of ID 0 is ignored")
        void releaseZeroIgnored() {
            assertFalse(tracker.release(0));
            assertEquals(0, tracker.getReleaseCount());
        }

        @Test
        @DisplayName("Records are grouped by owner")
        void groupedByOwner() {
            tracker.track("host0", "tag pool", 8);
            tracker.track("host1", "tag pool", 8);
            tracker.track("host1", "work queue", 0);

            assertEquals(1, tracker.getActiveCount("host0"));
            assertEquals(2, tracker.getActiveCount("host1"));
            assertEquals("work queue", tracker.getActiveResources("host1").stream()
                    .filter(r -> r.sizeBytes() == 0)
                    .findFirst()
                    .orElseThrow()
                    .resource());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatisticsTests {

        @Test
        @DisplayName("clear resets everything")
        void clearResets() {
            long id = tracker.track("host0", "host data", 16);
            tracker.release(id);
            tracker.track("host0", "host data", 16);

            tracker.clear();

            assertEquals(0, tracker.getActiveCount());
            assertEquals(0, tracker.getAcquisitionCount());
            assertEquals(0, tracker.getReleaseCount());
        }

        @Test
        @DisplayName("Summary includes counts")
        void summaryIncludesCounts() {
            tracker.track("host0", "private data", 100);

            String summary = tracker.getSummary();
            assertTrue(summary.contains("active=1"));
            assertTrue(summary.contains("100 bytes"));
        }

        @Test
        @DisplayName("Concurrent track and release balance out")
        void concurrentBalance() throws Exception {
            int threads = 8;
            int perThread = 500;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int t = 0; t < threads; t++) {
                    String owner = "host" + t;
                    executor.submit(
                            () -> {
                                start.await();
                                for (int i = 0; i < perThread; i++) {
                                    tracker.release(tracker.track(owner, "queue", 1));
                                }
                                return null;
                            });
                }
                start.countDown();
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            }

            assertEquals(0, tracker.getActiveCount());
            assertEquals(threads * perThread, tracker.getAcquisitionCount());
            assertEquals(threads * perThread, tracker.getReleaseCount());
        }
    }

    @Test
    @DisplayName("getInstance returns the shared tracker")
    void sharedInstance() {
        assertSame(ResourceTracker.getInstance(), ResourceTracker.getInstance());
    }
}
