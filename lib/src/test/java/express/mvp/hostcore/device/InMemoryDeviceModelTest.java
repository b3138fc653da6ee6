package express.mvp.hostcore.device;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.hostcore.error.RegistrationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link InMemoryDeviceModel} and {@link DeviceHandle}. */
@DisplayName("InMemoryDeviceModel")
class InMemoryDeviceModelTest {

    private InMemoryDeviceModel model;

    @BeforeEach
    void setUp() {
        model = new InMemoryDeviceModel();
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Platform root is registered")
        void platformRoot() {
            DeviceHandle root = model.platformRoot();
            assertEquals("platform", root.name());
            assertTrue(root.isRegistered());
            assertSame(root, model.find("platform"));
        }

        @Test
        @DisplayName("Registered devices can be found by name and kind")
        void registerAndFind() {
            DeviceHandle host = model.register("host0", model.platformRoot(), DeviceKind.HOST);

            assertTrue(host.isRegistered());
            assertSame(host, model.find("host0"));
            assertEquals(1, model.devices(DeviceKind.HOST).size());
            assertEquals(0, model.devices(DeviceKind.TARGET).size());
        }

        @Test
        @DisplayName("Duplicate names fail with the already-exists status")
        void duplicateName() {
            model.register("host0", model.platformRoot(), DeviceKind.HOST);

            RegistrationException e =
                    assertThrows(
                            RegistrationException.class,
                            () -> model.register("host0", model.platformRoot(), DeviceKind.HOST));
            assertEquals(-17, e.code());
        }

        @Test
        @DisplayName("unregister clears registration and power but keeps references")
        void unregister() {
            DeviceHandle host = model.register("host1", model.platformRoot(), DeviceKind.HOST);
            model.activatePower(host);

            model.unregister(host);
            model.unregister(host);

            assertFalse(host.isRegistered());
            assertFalse(host.isPowerEnabled());
            assertNull(model.find("host1"));
            assertEquals(1, host.refCount());
        }
    }

    @Nested
    @DisplayName("References and power")
    class HandleTests {

        @Test
        @DisplayName("acquire and release count references")
        void acquireRelease() {
            DeviceHandle root = model.platformRoot();

            model.acquire(root);
            assertEquals(2, root.refCount());
            model.release(root);
            assertEquals(1, root.refCount());
        }

        @Test
        @DisplayName("Last release reports true; releasing past zero fails")
        void releasePastZero() {
            DeviceHandle handle = new DeviceHandle("scratch", null, DeviceKind.DEVICE);

            assertTrue(handle.release());
            assertThrows(IllegalStateException.class, handle::release);
            assertThrows(IllegalStateException.class, handle::acquire);
        }

        @Test
        @DisplayName("Power activation and resume")
        void power() {
            DeviceHandle host = model.register("host2", model.platformRoot(), DeviceKind.HOST);
            assertFalse(host.isPowerActive());

            model.activatePower(host);
            assertTrue(host.isPowerActive());
            assertTrue(host.isPowerEnabled());

            model.resume(host);
            assertEquals(1, host.resumeCount());
        }
    }
}
