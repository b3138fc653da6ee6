package express.mvp.hostcore.device;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference-counted handle to an entry of the device model.
 *
 * <p>A handle starts with one reference owned by whoever created it. Power state is tracked for
 * runtime power management: a registered host device is marked active and enabled at publish and
 * resumed before removal.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Reference counting uses CAS loops; power flags are volatile.
 */
public final class DeviceHandle {

    private final String name;

    private final DeviceHandle parent;

    private final DeviceKind kind;

    private final AtomicInteger refCount = new AtomicInteger(1);

    private volatile boolean registered;

    private volatile boolean powerActive;

    private volatile boolean powerEnabled;

    private final AtomicInteger resumeCount = new AtomicInteger();

    /**
     * Creates a handle.
     *
     * @param name device name, unique within its model
     * @param parent parent device, or null for a root
     * @param kind what this device represents
     */
    public DeviceHandle(String name, DeviceHandle parent, DeviceKind kind) {
        this.name = name;
        this.parent = parent;
        this.kind = kind;
    }

    public String name() {
        return name;
    }

    public DeviceHandle parent() {
        return parent;
    }

    public DeviceKind kind() {
        return kind;
    }

    /**
     * Adds a reference.
     *
     * @throws IllegalStateException if the handle was already released to zero
     */
    public void acquire() {
        int c;
        do {
            c = refCount.get();
            if (c <= 0) {
                throw new IllegalStateException("Cannot acquire released device " + name);
            }
        } while (!refCount.compareAndSet(c, c + 1));
    }

    /**
     * Drops a reference.
     *
     * @return true if this was the last reference
     * @throws IllegalStateException if the count is already zero
     */
    public boolean release() {
        int c;
        do {
            c = refCount.get();
            if (c <= 0) {
                throw new IllegalStateException("Device " + name + " already released");
            }
        } while (!refCount.compareAndSet(c, c - 1));
        return c == 1;
    }

    public int refCount() {
        return refCount.get();
    }

    public boolean isRegistered() {
        return registered;
    }

    void registered(boolean registered) {
        this.registered = registered;
    }

    public boolean isPowerActive() {
        return powerActive;
    }

    public boolean isPowerEnabled() {
        return powerEnabled;
    }

    void powerActive(boolean active) {
        this.powerActive = active;
    }

    void powerEnabled(boolean enabled) {
        this.powerEnabled = enabled;
    }

    /**
     * Returns how many times the device was resumed.
     *
     * @return resume count
     */
    public int resumeCount() {
        return resumeCount.get();
    }

    void resumed() {
        resumeCount.incrementAndGet();
        powerActive = true;
    }

    @Override
    public String toString() {
        return "DeviceHandle{" + name + ", " + kind + ", ref=" + refCount.get() + "}";
    }
}
