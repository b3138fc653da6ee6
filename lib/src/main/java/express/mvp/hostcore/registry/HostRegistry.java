package express.mvp.hostcore.registry;

import express.mvp.hostcore.Host;
import express.mvp.hostcore.device.DeviceHandle;
import express.mvp.hostcore.device.DeviceKind;
import express.mvp.hostcore.error.RegistrationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Published hosts keyed by identity.
 *
 * <p>The registry holds one counted reference per entry, taken by the lifecycle manager before
 * {@link #add(Host)} and dropped by it after {@link #remove(Host)}. {@link #lookup(int)} hands out
 * a further reference of its own.
 *
 * <p>Lock order is registry lock, then host lock. The registry lock is held only for the map
 * access and the reference increment, never across a call that may block.
 */
public final class HostRegistry {

    private static final int EEXIST = -17;

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<Integer, Host> hosts = new LinkedHashMap<>();

    /**
     * Adds a host.
     *
     * @param host the host; its registry reference must already be taken
     * @throws RegistrationException if a host with the same identity is registered
     */
    public void add(Host host) {
        lock.lock();
        try {
            if (hosts.putIfAbsent(host.id(), host) != null) {
                throw new RegistrationException(EEXIST, host.name() + ": already registered");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a host. The registry reference is not dropped here.
     *
     * @param host the host
     * @return true if this exact host was registered
     */
    public boolean remove(Host host) {
        lock.lock();
        try {
            return hosts.remove(host.id(), host);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finds a live host by identity.
     *
     * @param id host identity
     * @return the host with a new reference the caller must {@link #put(Host)}, or null if no host
     *     with that identity is registered or it is already deleted
     */
    public Host lookup(int id) {
        lock.lock();
        try {
            Host host = hosts.get(id);
            if (host == null || !host.tryGet()) {
                return null;
            }
            return host;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a reference.
     *
     * @param host the host
     * @return the same host
     * @throws express.mvp.hostcore.error.AlreadyDeletedException if the host is deleted
     */
    public Host get(Host host) {
        return host.get();
    }

    /**
     * Drops a reference; the last one destroys the host.
     *
     * @param host the host
     */
    public void put(Host host) {
        host.put();
    }

    /**
     * Checks whether a device represents a host.
     *
     * @param device generic device handle
     * @return true for host devices
     */
    public static boolean isHostDevice(DeviceHandle device) {
        return device != null && device.kind() == DeviceKind.HOST;
    }

    /**
     * Returns the registered hosts in registration order. No references are taken.
     *
     * @return snapshot of the registered hosts
     */
    public List<Host> hosts() {
        lock.lock();
        try {
            return new ArrayList<>(hosts.values());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(int id) {
        lock.lock();
        try {
            return hosts.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return hosts.size();
        } finally {
            lock.unlock();
        }
    }
}
