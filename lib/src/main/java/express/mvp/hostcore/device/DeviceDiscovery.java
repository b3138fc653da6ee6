package express.mvp.hostcore.device;

import express.mvp.hostcore.Host;

/**
 * Discovery layer that enumerates and removes the devices behind a host.
 *
 * <p>The lifecycle core only calls {@link #forgetAllChildren(Host)} during removal, while holding
 * the host's scan lock.
 */
@FunctionalInterface
public interface DeviceDiscovery {

    /** Discovery layer with no children to forget. */
    DeviceDiscovery NONE = host -> { };

    /**
     * Synchronously removes every child device of the host.
     *
     * @param host the host being removed
     */
    void forgetAllChildren(Host host);
}
