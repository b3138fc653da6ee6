package express.mvp.hostcore.device;

import express.mvp.hostcore.error.RegistrationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Device model kept in process memory.
 *
 * <p>Names are unique: registering a name twice fails with a {@link RegistrationException}
 * carrying {@code -17}, the "already exists" status.
 */
public class InMemoryDeviceModel implements DeviceModel {

    private static final int EEXIST = -17;

    private final DeviceHandle platformRoot;

    private final Map<String, DeviceHandle> devices = new ConcurrentHashMap<>();

    public InMemoryDeviceModel() {
        this.platformRoot = new DeviceHandle("platform", null, DeviceKind.PLATFORM);
        platformRoot.registered(true);
        devices.put(platformRoot.name(), platformRoot);
    }

    @Override
    public DeviceHandle platformRoot() {
        return platformRoot;
    }

    @Override
    public DeviceHandle register(String name, DeviceHandle parent, DeviceKind kind) {
        DeviceHandle device = new DeviceHandle(name, parent, kind);
        if (devices.putIfAbsent(name, device) != null) {
            throw new RegistrationException(EEXIST, "Device " + name + " already registered");
        }
        device.registered(true);
        return device;
    }

    @Override
    public void unregister(DeviceHandle device) {
        if (devices.remove(device.name(), device)) {
            device.registered(false);
            device.powerEnabled(false);
        }
    }

    @Override
    public void acquire(DeviceHandle device) {
        device.acquire();
    }

    @Override
    public void release(DeviceHandle device) {
        device.release();
    }

    @Override
    public void activatePower(DeviceHandle device) {
        device.powerActive(true);
        device.powerEnabled(true);
    }

    @Override
    public void resume(DeviceHandle device) {
        device.resumed();
    }

    /**
     * Looks up a registered device by name.
     *
     * @param name the device name
     * @return the device, or null if none is registered under that name
     */
    public DeviceHandle find(String name) {
        return devices.get(name);
    }

    /**
     * Returns the registered devices of one kind.
     *
     * @param kind the kind to select
     * @return snapshot of matching devices
     */
    public List<DeviceHandle> devices(DeviceKind kind) {
        List<DeviceHandle> result = new ArrayList<>();
        for (DeviceHandle device : devices.values()) {
            if (device.kind() == kind) {
                result.add(device);
            }
        }
        return result;
    }
}
