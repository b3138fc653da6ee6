package express.mvp.hostcore.work;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.hostcore.Host;
import express.mvp.hostcore.HostLifecycleManager;
import express.mvp.hostcore.HostServices;
import express.mvp.hostcore.HostTemplate;
import express.mvp.hostcore.HostTransport;
import express.mvp.hostcore.error.HostErrorCode;
import express.mvp.hostcore.error.WorkQueueNotConfiguredException;
import express.mvp.hostcore.resource.ResourceTracker;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link WorkQueueBinding}. */
@DisplayName("WorkQueueBinding")
class WorkQueueBindingTest {

    private static final HostTransport QUEUED = new HostTransport("queued", 0, true);

    private HostLifecycleManager manager;

    private Host host;

    @BeforeEach
    void setUp() {
        manager =
                new HostLifecycleManager(
                        HostServices.builder().resourceTracker(new ResourceTracker()).build());
    }

    @AfterEach
    void tearDown() {
        if (host != null) {
            manager.remove(host);
            manager.release(host);
        }
    }

    private Host publish(HostTransport transport) {
        HostTemplate template =
                HostTemplate.builder("binding-test").canQueue(4).transport(transport).build();
        host = manager.allocate(template, 0);
        manager.publish(host);
        return host;
    }

    @Nested
    @DisplayName("With a work queue")
    class ConfiguredTests {

        @Test
        @DisplayName("Queued items run in submission order")
        void runsInOrder() {
            Host h = publish(QUEUED);
            List<Integer> order = new CopyOnWriteArrayList<>();
            for (int i = 0; i < 20; i++) {
                int n = i;
                assertTrue(WorkQueueBinding.queueWork(h, new HostWork(() -> order.add(n))));
            }

            WorkQueueBinding.flushWork(h);

            assertEquals(20, order.size());
            for (int i = 0; i < 20; i++) {
                assertEquals(i, order.get(i));
            }
        }

        @Test
        @DisplayName("flushWork returns only after earlier items complete")
        void flushWaitsForEarlierItems() throws Exception {
            Host h = publish(QUEUED);
            CountDownLatch started = new CountDownLatch(1);
            AtomicInteger done = new AtomicInteger();
            WorkQueueBinding.queueWork(
                    h,
                    new HostWork(
                            () -> {
                                started.countDown();
                                try {
                                    Thread.sleep(100);
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                }
                                done.incrementAndGet();
                            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            WorkQueueBinding.flushWork(h);

            assertEquals(1, done.get());
        }

        @Test
        @DisplayName("Queueing a pending item returns false")
        void pendingReturnsFalse() {
            Host h = publish(QUEUED);
            CountDownLatch blocker = new CountDownLatch(1);
            WorkQueueBinding.queueWork(
                    h,
                    new HostWork(
                            () -> {
                                try {
                                    blocker.await(5, TimeUnit.SECONDS);
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                }
                            }));
            HostWork work = new HostWork(() -> { });

            assertTrue(WorkQueueBinding.queueWork(h, work));
            assertFalse(WorkQueueBinding.queueWork(h, work));

            blocker.countDown();
            WorkQueueBinding.flushWork(h);
        }

        @Test
        @DisplayName("Queue is named after the host identity")
        void queueName() {
            Host h = publish(QUEUED);
            assertEquals("host_wq_" + Integer.toUnsignedString(h.id()), h.workQueue().name());
        }
    }

    @Nested
    @DisplayName("Without a work queue")
    class NotConfiguredTests {

        @Test
        @DisplayName("queueWork fails with not configured")
        void queueWorkFails() {
            Host h = publish(HostTransport.BLANK);
            WorkQueueNotConfiguredException e =
                    assertThrows(
                            WorkQueueNotConfiguredException.class,
                            () -> WorkQueueBinding.queueWork(h, new HostWork(() -> { })));
            assertEquals(HostErrorCode.NOT_CONFIGURED, e.errorCode());
            assertTrue(e.getMessage().contains("binding-test"));
            assertTrue(e.getMessage().contains("attempted to queue work"));
        }

        @Test
        @DisplayName("flushWork fails with not configured")
        void flushWorkFails() {
            Host h = publish(HostTransport.BLANK);
            WorkQueueNotConfiguredException e =
                    assertThrows(
                            WorkQueueNotConfiguredException.class,
                            () -> WorkQueueBinding.flushWork(h));
            assertTrue(e.getMessage().contains("attempted to flush work"));
        }
    }
}
