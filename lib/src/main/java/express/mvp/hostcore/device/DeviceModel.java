package express.mvp.hostcore.device;

import express.mvp.hostcore.error.RegistrationException;

/**
 * External device-model layer hosts register with.
 *
 * <p>Hosts register their primary device under an identity-derived name at publish and
 * unregister it during removal. Parent devices are reference counted so a published host keeps
 * its bus alive.
 *
 * @see InMemoryDeviceModel
 */
public interface DeviceModel {

    /**
     * Returns the generic platform owner used when publish is given no parent.
     *
     * @return the platform root device
     */
    DeviceHandle platformRoot();

    /**
     * Registers a device.
     *
     * @param name unique device name
     * @param parent parent device
     * @param kind what the device represents
     * @return the registered handle
     * @throws RegistrationException if the device cannot be registered
     */
    DeviceHandle register(String name, DeviceHandle parent, DeviceKind kind);

    /**
     * Removes a device from the model. The handle's own references are untouched.
     *
     * @param device the registered device
     */
    void unregister(DeviceHandle device);

    /**
     * Adds a reference to a device.
     *
     * @param device the device
     */
    void acquire(DeviceHandle device);

    /**
     * Drops a reference to a device.
     *
     * @param device the device
     */
    void release(DeviceHandle device);

    /**
     * Marks a device's runtime power state active and enables runtime power management.
     *
     * @param device the device
     */
    void activatePower(DeviceHandle device);

    /**
     * Resumes a device that runtime power management may have suspended.
     *
     * @param device the device
     */
    void resume(DeviceHandle device);
}
